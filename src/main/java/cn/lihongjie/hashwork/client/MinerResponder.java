package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.client.device.DeviceJob;
import cn.lihongjie.hashwork.client.device.DeviceLink;
import cn.lihongjie.hashwork.client.device.DevicePoll;
import cn.lihongjie.hashwork.codec.ChallengeTokenCodec;
import cn.lihongjie.hashwork.config.MinerConfig;
import cn.lihongjie.hashwork.core.ProofHash;
import cn.lihongjie.hashwork.exception.DeviceLinkException;
import cn.lihongjie.hashwork.exception.ProtocolException;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.Proof;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 矿工侧 Challenge 响应器
 *
 * <p><b>流程</b>：
 * <ol>
 *   <li>解析 Challenge 消息（持有验证方密钥时校验签名与目标矿工）</li>
 *   <li>截止时间 = 收到时间 + timeout − safetyMargin</li>
 *   <li>健康单元按 ID 排序，nonce 空间切成互不重叠的区间逐一下发，每个单元独立线程轮询</li>
 *   <li>单元故障、过温或报告无效 Share：标记降级，其区间转交软件求解</li>
 *   <li>没有健康单元（或全部下发失败）：软件求解完整空间</li>
 *   <li>任何候选 nonce 都在本地复验，通过后放入出站队列</li>
 *   <li>截止时间前无结果：返回"无解"，不做迟到提交</li>
 * </ol>
 *
 * <p>硬件故障在此吸收，不向协议层传播。
 *
 * @author lihongjie
 */
public class MinerResponder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MinerResponder.class);

    private final String minerId;
    private final MinerConfig config;
    private final DeviceLink link;
    private final DeviceRegistry registry;
    private final SoftwareSolver softwareSolver;
    private final ProofSubmitter submitter;
    private final ChallengeTokenCodec verifyingCodec;
    private final Clock clock;
    private final ExecutorService pollers;

    /**
     * @param submitter 出站队列（可为 null，仅返回结果不发送）
     * @param verifyingCodec 持有验证方密钥的编解码器（可为 null，不校验签名）
     */
    public MinerResponder(String minerId, MinerConfig config, DeviceLink link, SoftwareSolver softwareSolver,
                          ProofSubmitter submitter, ChallengeTokenCodec verifyingCodec, Clock clock) {
        this.minerId = Objects.requireNonNull(minerId, "Miner id cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.link = Objects.requireNonNull(link, "Device link cannot be null");
        this.softwareSolver = Objects.requireNonNull(softwareSolver, "Software solver cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.submitter = submitter;
        this.verifyingCodec = verifyingCodec;
        this.registry = new DeviceRegistry(link, config);
        AtomicInteger counter = new AtomicInteger();
        this.pollers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "device-poller-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 处理一条 Challenge 消息；格式错误或签名不符的消息记录日志后丢弃
     */
    public MinerResponse respond(String token) {
        long receivedAt = clock.millis();
        Challenge challenge;
        try {
            challenge = verifyingCodec != null
                    ? verifyingCodec.decode(token, Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, minerId))
                    : ChallengeTokenCodec.decodeUnverified(token);
        } catch (ProtocolException e) {
            log.warn("Dropped challenge message [miner={}, reason={}]", minerId, e.getMessage());
            return MinerResponse.noSolution(null, "malformed challenge: " + e.getMessage());
        }
        return respond(challenge, receivedAt);
    }

    public MinerResponse respond(Challenge challenge) {
        return respond(challenge, clock.millis());
    }

    private MinerResponse respond(Challenge challenge, long receivedAt) {
        long deadline = receivedAt + challenge.getTimeoutMillis() - config.getSafetyMarginMillis();
        log.info("Challenge received [miner={}, id={}, class={}, target=0x{}, budget={}ms]",
                minerId, challenge.getId(), challenge.getChallengeClass().getCode(),
                String.format("%08x", challenge.getDifficultyTarget()), deadline - receivedAt);
        if (deadline <= clock.millis()) {
            log.warn("Challenge budget already exhausted [id={}]", challenge.getId());
            return MinerResponse.noSolution(challenge.getId(), "no time budget");
        }

        SolveOutcome outcome = solve(challenge, deadline);
        long now = clock.millis();
        if (!outcome.isFound() || now > deadline) {
            log.warn("No solution before deadline [miner={}, id={}, outcome={}]", minerId, challenge.getId(), outcome);
            return MinerResponse.noSolution(challenge.getId(), outcome.getReason() != null
                    ? outcome.getReason() : "deadline reached");
        }

        Proof proof = new Proof(challenge.getId(), outcome.getNonce(), now - receivedAt, outcome.getDeviceId(), now);
        if (submitter != null) {
            submitter.enqueue(proof);
        }
        log.info("Challenge solved [miner={}, id={}, nonce={}, device={}, elapsed={}ms]",
                minerId, challenge.getId(), proof.getNonce(), proof.getDeviceId(), proof.getElapsedMs());
        return MinerResponse.solved(proof);
    }

    private SolveOutcome solve(Challenge challenge, long deadline) {
        byte[] payload = ProofHash.hexToBytes(challenge.getPayloadHex());
        long target = challenge.getDifficultyTarget();
        AtomicBoolean stop = new AtomicBoolean(false);
        CompletableFuture<SolveOutcome> winner = new CompletableFuture<>();
        Map<String, String> activeJobs = new ConcurrentHashMap<>();

        List<String> healthy = registry.healthyDevices(clock.millis());
        List<NonceRange> fallback = new ArrayList<>();
        List<CompletableFuture<SolveOutcome>> paths = new ArrayList<>();

        if (healthy.isEmpty()) {
            fallback.add(NonceRange.full());
        } else {
            List<NonceRange> ranges = NonceRange.full().split(healthy.size());
            for (int i = 0; i < healthy.size(); i++) {
                String deviceId = healthy.get(i);
                NonceRange range = ranges.get(i);
                DeviceJob job = new DeviceJob(deviceId, challenge.getId(), challenge.getPayloadHex(),
                        target, range.getStart(), range.getEnd());
                try {
                    String jobId = link.submit(job);
                    activeJobs.put(deviceId, jobId);
                    paths.add(CompletableFuture.supplyAsync(
                            () -> pollDevice(deviceId, jobId, range, payload, target, deadline, stop, winner, activeJobs),
                            pollers));
                } catch (DeviceLinkException e) {
                    registry.markDegraded(deviceId, clock.millis(), "submit failed: " + e.getMessage());
                    fallback.add(range);
                }
            }
        }

        if (!fallback.isEmpty()) {
            log.info("Using software fallback [id={}, ranges={}]", challenge.getId(), fallback);
            paths.add(CompletableFuture.supplyAsync(
                    () -> offerIfFound(software(payload, target, fallback, deadline, stop), winner),
                    pollers));
        }

        for (CompletableFuture<SolveOutcome> path : paths) {
            path.whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Solving path failed [id={}]", challenge.getId(), unwrap(error));
                }
            });
        }
        CompletableFuture.allOf(paths.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> winner.complete(error == null
                        ? SolveOutcome.timedOut(null)
                        : SolveOutcome.fault(null, "solving failed: " + unwrap(error).getMessage())));

        SolveOutcome outcome;
        try {
            outcome = winner.get(Math.max(0L, deadline - clock.millis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            outcome = SolveOutcome.timedOut(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = SolveOutcome.timedOut(null);
        } catch (ExecutionException e) {
            log.error("Solving path failed unexpectedly [id={}]", challenge.getId(), e.getCause());
            outcome = SolveOutcome.timedOut(null);
        } finally {
            stop.set(true);
        }

        for (Map.Entry<String, String> job : activeJobs.entrySet()) {
            cancelQuietly(job.getKey(), job.getValue());
        }
        return outcome;
    }

    /**
     * 单个求解单元的轮询循环；故障时把区间转交软件求解
     */
    private SolveOutcome pollDevice(String deviceId, String jobId, NonceRange range, byte[] payload, long target,
                                    long deadline, AtomicBoolean stop, CompletableFuture<SolveOutcome> winner,
                                    Map<String, String> activeJobs) {
        String faultReason = null;
        while (!stop.get() && clock.millis() < deadline) {
            DevicePoll poll;
            try {
                poll = link.poll(jobId);
            } catch (DeviceLinkException e) {
                faultReason = "poll failed: " + e.getMessage();
                break;
            }

            if (registry.isOverTemperature(poll.getTelemetry())) {
                faultReason = "over temperature " + poll.getTelemetry().getTemperature() + "C";
                break;
            }
            if (poll.getStatus() == DevicePoll.Status.FAULT) {
                faultReason = poll.getReason();
                break;
            }
            if (poll.getStatus() == DevicePoll.Status.FOUND) {
                long nonce = poll.getNonce();
                if (range.contains(nonce) && ProofHash.verify(payload, nonce, target)) {
                    log.info("Device share verified [device={}, nonce={}]", deviceId, nonce);
                    return offerIfFound(SolveOutcome.found(nonce, deviceId), winner);
                }
                faultReason = "invalid share nonce=" + nonce;
                break;
            }

            try {
                Thread.sleep(config.getPollIntervalMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SolveOutcome.timedOut(deviceId);
            }
        }

        if (faultReason == null) {
            return SolveOutcome.timedOut(deviceId);
        }

        registry.markDegraded(deviceId, clock.millis(), faultReason);
        if (activeJobs.remove(deviceId) != null) {
            cancelQuietly(deviceId, jobId);
        }
        if (stop.get() || clock.millis() >= deadline) {
            return SolveOutcome.fault(deviceId, faultReason);
        }
        log.info("Handing range to software fallback [device={}, range={}]", deviceId, range);
        return offerIfFound(software(payload, target, Collections.singletonList(range), deadline, stop), winner);
    }

    /**
     * 软件路径的候选同样经过本地复验
     */
    private SolveOutcome software(byte[] payload, long target, List<NonceRange> ranges,
                                  long deadline, AtomicBoolean stop) {
        SolveOutcome outcome = softwareSolver.solve(payload, target, ranges, deadline, stop);
        if (outcome.isFound() && !ProofHash.verify(payload, outcome.getNonce(), target)) {
            log.error("Software candidate failed local verification [nonce={}]", outcome.getNonce());
            return SolveOutcome.fault(SoftwareSolver.DEVICE_ID, "candidate failed verification");
        }
        return outcome;
    }

    private static SolveOutcome offerIfFound(SolveOutcome outcome, CompletableFuture<SolveOutcome> winner) {
        if (outcome.isFound()) {
            winner.complete(outcome);
        }
        return outcome;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private void cancelQuietly(String deviceId, String jobId) {
        try {
            link.cancel(jobId);
        } catch (DeviceLinkException e) {
            log.warn("Failed to cancel device job [device={}, jobId={}, error={}]", deviceId, jobId, e.getMessage());
        }
    }

    public DeviceRegistry getRegistry() {
        return registry;
    }

    public String getMinerId() {
        return minerId;
    }

    @Override
    public void close() {
        pollers.shutdownNow();
    }
}
