package com.bit.sdupi.result;

import com.bit.sdupi.core.TokenException;
import lombok.Data;

import java.io.Serializable;

/**
 *   接口返回数据格式
 */
@Data
public class Result<T> implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Integer SC_OK_200 = 200;

    /**
     * 成功标志 true=成功，false=失败
     */
    private boolean success = true;

    /**
     * 返回处理消息
     */
    private String message = "";

    /**
     * 返回代码，失败时为 ErrorType 的错误码
     */
    private Integer code = 0;

    /**
     * 错误类型名称，成功时为空
     */
    private String error;

    /**
     * 返回数据对象 data
     */
    private T data;

    /**
     * 时间戳
     */
    private long timestamp = System.currentTimeMillis();

    public Result() {
    }

    public static<T> Result<T> OK(T data) {
        Result<T> r = new Result<T>();
        r.setSuccess(true);
        r.setCode(SC_OK_200);
        r.setData(data);
        return r;
    }

    public static<T> Result<T> error(int code, String msg) {
        Result<T> r = new Result<T>();
        r.setCode(code);
        r.setMessage(msg);
        r.setSuccess(false);
        return r;
    }

    /**
     * 核心异常转换为失败结果，保留错误类型便于调用方断言
     */
    public static<T> Result<T> error(TokenException e) {
        Result<T> r = error(e.getErrorType().getCode(), e.getMessage());
        r.setError(e.getErrorType().name());
        return r;
    }
}
