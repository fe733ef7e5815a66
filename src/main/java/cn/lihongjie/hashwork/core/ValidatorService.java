package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.codec.ChallengeTokenCodec;
import cn.lihongjie.hashwork.codec.ProofMessageCodec;
import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.exception.HashWorkException;
import cn.lihongjie.hashwork.exception.ProtocolException;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.MinerRecord;
import cn.lihongjie.hashwork.model.MinerSnapshot;
import cn.lihongjie.hashwork.model.Proof;
import cn.lihongjie.hashwork.model.Score;
import cn.lihongjie.hashwork.model.VerificationOutcome;
import cn.lihongjie.hashwork.model.VerificationResult;
import cn.lihongjie.hashwork.store.Checkpoint;
import cn.lihongjie.hashwork.store.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 验证方编排服务
 *
 * <p><b>流程</b>：
 * <pre>
 * issue:      生成 Challenge（矿工级难度覆盖）→ 登记台账 → 签发 JWT
 * submit:     [矿工串行队列] 校验 → 快照 → 评分 → 更新 MinerRecord 与难度
 * expire:     清扫超时 Challenge，按失败挑战计分
 * balance:    每个结论汇入全网成功率，越过性能带时调整类别配比并重建抽样表
 * closeEpoch: 独占锁下聚合本 epoch 评分，导出归一化权重
 * checkpoint: 定期持久化全部 MinerRecord
 * </pre>
 *
 * <p>同一矿工的状态更新只在其串行队列上发生；epoch 聚合持有写锁，与更新互斥。
 *
 * @author lihongjie
 */
public class ValidatorService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ValidatorService.class);

    /**
     * 过期清扫周期
     */
    private static final long SWEEP_INTERVAL_MILLIS = 1_000L;

    private final ValidatorConfig config;
    private final Clock clock;
    private final ChallengeTokenCodec tokenCodec;
    private final ProofMessageCodec proofCodec;
    private final CheckpointStore checkpointStore;

    private final ChallengeGenerator generator;
    private final DifficultyController difficultyController;
    private final ChallengeLedger ledger;
    private final ProofVerifier verifier;
    private final ScoringEngine scoringEngine;
    private final ConsensusWeightAggregator aggregator;
    private final MinerTaskQueue taskQueue;
    private final NetworkClassBalancer classBalancer;

    private final Map<String, MinerRecord> records = new ConcurrentHashMap<>();
    private final ReadWriteLock epochLock = new ReentrantReadWriteLock();
    private volatile Map<String, List<Score>> epochScores = new ConcurrentHashMap<>();

    private ScheduledExecutorService scheduler;

    /**
     * @param checkpointStore 检查点存储（可为 null，表示不持久化）
     */
    public ValidatorService(ValidatorConfig config, ChallengeTokenCodec tokenCodec,
                            CheckpointStore checkpointStore, Clock clock, Random classRandom) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.tokenCodec = Objects.requireNonNull(tokenCodec, "Token codec cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.checkpointStore = checkpointStore;
        this.proofCodec = new ProofMessageCodec();

        this.generator = new ChallengeGenerator(config, clock, classRandom);
        this.difficultyController = new DifficultyController(config);
        this.ledger = new ChallengeLedger(config.getGracePeriodMillis());
        this.verifier = new ProofVerifier(ledger);
        this.scoringEngine = new ScoringEngine(config);
        this.aggregator = new ConsensusWeightAggregator(config);
        this.taskQueue = new MinerTaskQueue(Math.max(2, Runtime.getRuntime().availableProcessors()));
        this.classBalancer = new NetworkClassBalancer(config, generator::updateClassWeights);

        restore();
    }

    public ValidatorService(ValidatorConfig config, String secret, CheckpointStore checkpointStore) {
        this(config, new ChallengeTokenCodec(secret), checkpointStore, Clock.systemUTC(), new SecureRandom());
    }

    /**
     * 启动定期过期清扫与检查点
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "validator-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::sweepQuietly,
                SWEEP_INTERVAL_MILLIS, SWEEP_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
        if (checkpointStore != null) {
            long interval = config.getCheckpointIntervalMillis();
            scheduler.scheduleWithFixedDelay(this::checkpointQuietly, interval, interval, TimeUnit.MILLISECONDS);
        }
        log.info("Validator started [checkpointInterval={}ms, store={}]", config.getCheckpointIntervalMillis(),
                checkpointStore != null ? checkpointStore.getFile() : "none");
    }

    /**
     * 为矿工签发下一个 Challenge
     */
    public Challenge issueChallenge(String minerId) {
        Objects.requireNonNull(minerId, "Miner id cannot be null");
        return join(taskQueue.submit(minerId, () -> {
            MinerRecord record = recordFor(minerId);
            Challenge challenge = generator.generate(record, difficultyController);
            ledger.register(challenge, minerId);
            ledger.markAwaiting(challenge.getId());
            return challenge;
        }));
    }

    /**
     * 签发 Challenge 并编码为消息
     */
    public String issue(String minerId) {
        Challenge challenge = issueChallenge(minerId);
        return tokenCodec.encode(challenge, Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, minerId));
    }

    /**
     * 处理一条 Proof 消息；格式错误的消息记录日志后丢弃
     *
     * @return 评分结果；消息格式错误时以 ProtocolException 异常完成
     */
    public CompletableFuture<Score> submit(String minerId, String proofMessage) {
        long receivedAt = clock.millis();
        Proof proof;
        try {
            proof = proofCodec.decode(proofMessage, receivedAt);
        } catch (ProtocolException e) {
            log.warn("Dropped malformed proof message [miner={}, reason={}]", minerId, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return submit(minerId, proof);
    }

    /**
     * 处理一个已解码的 Proof，submittedAt 以验证方时钟为准
     */
    public CompletableFuture<Score> submit(String minerId, Proof proof) {
        Objects.requireNonNull(minerId, "Miner id cannot be null");
        Objects.requireNonNull(proof, "Proof cannot be null");
        return taskQueue.submit(minerId, () -> {
            VerificationResult result = verifier.verify(minerId, proof);
            if (result.getOutcome() == VerificationOutcome.STALE && !records.containsKey(minerId)) {
                log.warn("Ignoring proof from untracked miner [miner={}, challengeId={}]",
                        minerId, proof.getChallengeId());
                return scoringEngine.score(result, MinerSnapshot.builder().minerId(minerId).build());
            }
            return fold(minerId, result);
        });
    }

    /**
     * 清扫超时 Challenge，每个都按失败挑战计分
     */
    public List<Score> expireOverdue() {
        List<ChallengeLedger.Entry> expired = ledger.sweepExpired(clock.millis());
        List<CompletableFuture<Score>> pending = new ArrayList<>(expired.size());
        for (ChallengeLedger.Entry entry : expired) {
            VerificationResult result = VerificationResult.expired(entry.getChallenge(), entry.getMinerId());
            pending.add(taskQueue.submit(entry.getMinerId(), () -> fold(entry.getMinerId(), result)));
        }
        List<Score> scores = new ArrayList<>(pending.size());
        for (CompletableFuture<Score> future : pending) {
            scores.add(join(future));
        }
        return scores;
    }

    /**
     * 结束当前 epoch：等待进行中的矿工任务，独占地聚合权重
     */
    public EpochWeights closeEpoch() {
        epochLock.writeLock().lock();
        try {
            Map<String, List<Score>> closing = epochScores;
            epochScores = new ConcurrentHashMap<>();
            return aggregator.aggregate(closing, records.values());
        } finally {
            epochLock.writeLock().unlock();
        }
    }

    /**
     * 立即写检查点
     */
    public void checkpoint() {
        if (checkpointStore == null) {
            return;
        }
        Checkpoint checkpoint;
        epochLock.writeLock().lock();
        try {
            List<MinerSnapshot> snapshots = new ArrayList<>(records.size());
            for (MinerRecord record : records.values()) {
                snapshots.add(record.snapshot());
            }
            checkpoint = new Checkpoint(clock.millis(), aggregator.getEpoch(), snapshots);
        } finally {
            epochLock.writeLock().unlock();
        }
        checkpointStore.save(checkpoint);
    }

    public Optional<MinerSnapshot> snapshot(String minerId) {
        if (!records.containsKey(minerId)) {
            return Optional.empty();
        }
        return Optional.of(join(taskQueue.submit(minerId, () -> records.get(minerId).snapshot())));
    }

    public int trackedMiners() {
        return records.size();
    }

    public ChallengeLedger getLedger() {
        return ledger;
    }

    public ValidatorConfig getConfig() {
        return config;
    }

    /**
     * 替换基准类别权重（全网配比调节在其上继续生效）；评分常量在服务生命周期内固定
     */
    public void updateClassWeights(ValidatorConfig updated) {
        classBalancer.rebase(updated.getClassWeights());
    }

    /**
     * 当前生效的类别权重
     */
    public Map<ChallengeClass, Double> getClassWeights() {
        return classBalancer.getWeights();
    }

    public NetworkClassBalancer.Band getNetworkBand() {
        return classBalancer.getBand();
    }

    public double classProbability(ChallengeClass challengeClass) {
        return generator.classProbability(challengeClass);
    }

    private Score fold(String minerId, VerificationResult result) {
        epochLock.readLock().lock();
        try {
            MinerRecord record = recordFor(minerId);
            Score score = scoringEngine.score(result, record.snapshot());
            record.recordOutcome(result);
            difficultyController.observe(record, result.isAccepted());
            classBalancer.observe(result.isAccepted());
            epochScores.computeIfAbsent(minerId, id -> Collections.synchronizedList(new ArrayList<>())).add(score);
            log.info("Scored challenge [miner={}, challengeId={}, outcome={}, final={}]",
                    minerId, result.getChallengeId(), result.getOutcome(), String.format("%.4f", score.getFinal()));
            return score;
        } finally {
            epochLock.readLock().unlock();
        }
    }

    private MinerRecord recordFor(String minerId) {
        return records.computeIfAbsent(minerId, id -> {
            log.info("Tracking new miner [miner={}]", id);
            return new MinerRecord(id, clock.millis(), config.getAlphaLow(), config.getAlphaHigh(),
                    config.getRecentWindow(), config.getInitialDifficultyTarget());
        });
    }

    private void restore() {
        if (checkpointStore == null) {
            return;
        }
        Optional<Checkpoint> loaded = checkpointStore.load();
        if (loaded.isEmpty()) {
            return;
        }
        Checkpoint checkpoint = loaded.get();
        for (MinerSnapshot snapshot : checkpoint.getMiners()) {
            records.put(snapshot.getMinerId(), MinerRecord.restore(snapshot,
                    config.getAlphaLow(), config.getAlphaHigh(), config.getRecentWindow()));
        }
        aggregator.resumeFrom(checkpoint.getEpoch());
        log.info("Restored validator state [miners={}, epoch={}]", records.size(), checkpoint.getEpoch());
    }

    private void sweepQuietly() {
        try {
            expireOverdue();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
        }
    }

    private void checkpointQuietly() {
        try {
            checkpoint();
        } catch (RuntimeException e) {
            log.error("Periodic checkpoint failed", e);
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new HashWorkException("Miner task failed", cause);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
        taskQueue.drain();
        checkpoint();
        taskQueue.close();
        log.info("Validator stopped [miners={}]", records.size());
    }
}
