package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.model.Proof;

/**
 * Proof 出站通道（需外部实现，如 HTTP / 网络层）
 *
 * @author lihongjie
 */
public interface ProofTransport {

    /**
     * 发送一个 Proof；失败时抛出运行时异常
     */
    void send(Proof proof);
}
