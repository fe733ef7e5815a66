package cn.lihongjie.hashwork.exception;

/**
 * 报文格式错误（Challenge / Proof 无法解析、字段缺失、签名不符）
 *
 * <p>接收方记录日志后丢弃该报文，不计入矿工统计。
 *
 * @author lihongjie
 */
public class ProtocolException extends HashWorkException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
