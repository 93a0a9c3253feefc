package com.promptroute.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义路由服务所有 API 响应的响应码、描述信息以及调用方是否可重试。
 * </p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功", false),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败", false),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数", false),

    /** 特征记录不合法，仅拒绝当前请求 */
    INVALID_FEATURE_INPUT("0003", "特征输入不合法", false),

    /** 权重存储或账本读写失败，可重试 */
    PERSISTENCE_UNAVAILABLE("0004", "持久化服务不可用", true);

    private final String code;
    private final String info;
    private final boolean retryable;

    ResponseCode(String code, String info, boolean retryable) {
        this.code = code;
        this.info = info;
        this.retryable = retryable;
    }

}
