package com.promptroute.api.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 统一响应结果封装类。
 * <p>
 * 所有路由工具接口均以此结构返回：code 为响应码，info 为描述，data 为业务数据。
 * 失败时 data 为空，code 取自 ResponseCode。
 * </p>
 *
 * @param <T> 响应数据的类型
 * @author promptroute
 * @since 2026-10-01
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Response<T> implements Serializable {

    private static final long serialVersionUID = 2190348817425086712L;

    /** 响应码，成功为"0000" */
    private String code;

    /** 响应描述信息 */
    private String info;

    /** 调用方是否可以重试，仅失败时有意义 */
    private Boolean retryable;

    /** 响应数据 */
    private T data;

}
