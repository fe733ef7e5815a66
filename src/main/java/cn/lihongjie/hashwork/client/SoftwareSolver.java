package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.config.MinerConfig;
import cn.lihongjie.hashwork.core.ProofHash;
import cn.lihongjie.hashwork.exception.HashWorkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * 软件求解器（硬件不可用时的兜底路径）
 *
 * <p><b>算法</b>：穷举 nonce，使得 SHA-256(payload || nonce_le32) ≤ target
 *
 * <p><b>实现</b>：
 * <ul>
 *   <li>区间按线程数分段，ExecutorService 上并行搜索，先找到者胜出</li>
 *   <li>每次 solve 调用各自拥有 threads 个 worker，并发的兜底调用互不等待</li>
 *   <li>每个线程复用自己的 MessageDigest，字节数组比对</li>
 *   <li>每 hashCheckInterval 次哈希检查一次截止时间与取消标志（协作式取消）</li>
 * </ul>
 *
 * @author lihongjie
 */
public class SoftwareSolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SoftwareSolver.class);

    public static final String DEVICE_ID = "software";

    private final int threads;
    private final int checkInterval;
    private final Clock clock;
    private final ExecutorService executor;

    public SoftwareSolver(int threads, int checkInterval, Clock clock) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be >= 1");
        }
        if (checkInterval < 1) {
            throw new IllegalArgumentException("Check interval must be >= 1");
        }
        this.threads = threads;
        this.checkInterval = checkInterval;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "software-solver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public SoftwareSolver(MinerConfig config, Clock clock) {
        this(config.getSoftwareThreads(), config.getHashCheckInterval(), clock);
    }

    /**
     * 在给定区间内搜索，直到找到、截止时间到达、被取消或区间耗尽
     *
     * @param deadline 截止时间（毫秒时间戳，按注入的 Clock）
     * @param cancelled 外部取消标志
     */
    public SolveOutcome solve(byte[] payload, long target, List<NonceRange> ranges,
                              long deadline, AtomicBoolean cancelled) {
        Objects.requireNonNull(payload, "Payload cannot be null");
        Objects.requireNonNull(ranges, "Ranges cannot be null");
        byte[] expanded = ProofHash.expandTarget(target);

        AtomicLong found = new AtomicLong(-1L);
        AtomicBoolean stop = new AtomicBoolean(false);
        LongAdder attempts = new LongAdder();
        long startTime = clock.millis();

        List<Future<?>> workers = new ArrayList<>();
        for (NonceRange range : ranges) {
            for (NonceRange piece : range.split((int) Math.min(threads, Math.max(1L, range.size())))) {
                workers.add(executor.submit(() ->
                        search(payload, expanded, piece, deadline, cancelled, stop, found, attempts)));
            }
        }
        log.info("Starting software search [ranges={}, workers={}, target=0x{}, budget={}ms]",
                ranges, workers.size(), String.format("%08x", target), deadline - startTime);

        for (Future<?> worker : workers) {
            try {
                worker.get();
            } catch (InterruptedException e) {
                stop.set(true);
                Thread.currentThread().interrupt();
                return SolveOutcome.timedOut(DEVICE_ID);
            } catch (ExecutionException e) {
                stop.set(true);
                log.error("Software search worker failed", e.getCause());
                throw new HashWorkException("Software search failed: " + e.getCause().getMessage(), e.getCause());
            }
        }

        long elapsedMs = clock.millis() - startTime;
        long nonce = found.get();
        if (nonce >= 0) {
            double hashRate = attempts.sum() / (Math.max(1L, elapsedMs) / 1000.0);
            log.info("Software solution FOUND [nonce={}, attempts={}, time={}ms, hashrate={}/s]",
                    nonce, attempts.sum(), elapsedMs, String.format("%.2f", hashRate));
            return SolveOutcome.found(nonce, DEVICE_ID);
        }
        if (cancelled.get() || clock.millis() >= deadline) {
            log.info("Software search stopped [attempts={}, time={}ms, cancelled={}]",
                    attempts.sum(), elapsedMs, cancelled.get());
            return SolveOutcome.timedOut(DEVICE_ID);
        }
        log.warn("Software search exhausted ranges without solution [attempts={}]", attempts.sum());
        return SolveOutcome.exhausted(DEVICE_ID);
    }

    private void search(byte[] payload, byte[] expanded, NonceRange piece, long deadline,
                        AtomicBoolean cancelled, AtomicBoolean stop, AtomicLong found, LongAdder attempts) {
        MessageDigest digest = ProofHash.newDigest();
        long counted = 0;
        for (long nonce = piece.getStart(); nonce < piece.getEnd(); nonce++) {
            if (counted % checkInterval == 0) {
                attempts.add(counted);
                counted = 0;
                if (stop.get() || cancelled.get() || clock.millis() >= deadline) {
                    return;
                }
            }
            counted++;
            if (ProofHash.meetsTarget(ProofHash.hash(digest, payload, nonce), expanded)) {
                attempts.add(counted);
                if (found.compareAndSet(-1L, nonce)) {
                    stop.set(true);
                }
                return;
            }
        }
        attempts.add(counted);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
