package com.promptroute.types.exception;

import com.promptroute.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一处理路由服务中的业务异常，包含异常码和异常描述信息。
 * 单次请求的失败（非法特征、持久化不可用等）均通过此类抛出，由上层统一捕获，
 * 不会影响服务中其它请求。
 * </p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /** 调用方是否可以重试 */
    private boolean retryable;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 按响应码创建异常，可重试标记取自响应码定义。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param cause 异常原因，可为空
     */
    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        super(message, cause);
        this.code = responseCode.getCode();
        this.info = message;
        this.retryable = responseCode.isRetryable();
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return "com.promptroute.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                ", retryable=" + retryable +
                '}';
    }

}
