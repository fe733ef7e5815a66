package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.model.Proof;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Proof 出站队列：单个发送线程，入队从不阻塞调用方
 *
 * <p>发送失败只记录日志，不重试（Challenge 生命周期内不重发）。
 *
 * @author lihongjie
 */
public class ProofSubmitter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProofSubmitter.class);

    private final BlockingQueue<Proof> outbound = new LinkedBlockingQueue<>();
    private final ProofTransport transport;
    private final Thread sender;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile boolean running = true;

    public ProofSubmitter(ProofTransport transport) {
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.sender = new Thread(this::sendLoop, "proof-submitter");
        this.sender.setDaemon(true);
        this.sender.start();
    }

    /**
     * 入队，立即返回
     */
    public void enqueue(Proof proof) {
        Objects.requireNonNull(proof, "Proof cannot be null");
        if (!running) {
            log.warn("Submitter closed, dropping proof [challengeId={}]", proof.getChallengeId());
            return;
        }
        outbound.offer(proof);
    }

    private void sendLoop() {
        while (running || !outbound.isEmpty()) {
            Proof proof;
            try {
                proof = outbound.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (proof == null) {
                continue;
            }
            try {
                transport.send(proof);
                sent.incrementAndGet();
                log.info("Proof sent [challengeId={}, nonce={}, device={}]",
                        proof.getChallengeId(), proof.getNonce(), proof.getDeviceId());
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                log.error("Failed to send proof [challengeId={}]", proof.getChallengeId(), e);
            }
        }
    }

    public long getSentCount() {
        return sent.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public int pending() {
        return outbound.size();
    }

    /**
     * 发送完队列中剩余的 Proof 后停止
     */
    @Override
    public void close() {
        running = false;
        try {
            sender.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (sender.isAlive()) {
            log.warn("Proof submitter did not stop in time [pending={}]", outbound.size());
            sender.interrupt();
        }
    }
}
