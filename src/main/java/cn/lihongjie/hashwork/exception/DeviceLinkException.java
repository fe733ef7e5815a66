package cn.lihongjie.hashwork.exception;

/**
 * 硬件求解单元 RPC 调用失败（连接、超时、应答格式）
 *
 * <p>由 MinerResponder 按硬件故障处理，不向协议层传播。
 *
 * @author lihongjie
 */
public class DeviceLinkException extends HashWorkException {

    public DeviceLinkException(String message) {
        super(message);
    }

    public DeviceLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
