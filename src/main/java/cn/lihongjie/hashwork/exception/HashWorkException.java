package cn.lihongjie.hashwork.exception;

/**
 * HashWork 系统统一异常类
 *
 * @author lihongjie
 */
public class HashWorkException extends RuntimeException {

    public HashWorkException(String message) {
        super(message);
    }

    public HashWorkException(String message, Throwable cause) {
        super(message, cause);
    }
}
