package cn.lihongjie.hashwork.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;

/**
 * 单个矿工的滚动状态（验证方持有）
 *
 * <p>非线程安全：同一矿工的所有更新都由其专属的串行任务队列执行，
 * 评分与检查点只读取 {@link #snapshot()}。矿工活跃期间不删除。
 *
 * @author lihongjie
 */
public class MinerRecord {

    /**
     * 2^32，压缩目标对应的 nonce 空间大小
     */
    private static final double NONCE_SPACE = 4_294_967_296.0;

    private final String minerId;
    private final long firstSeenAt;
    private final double alphaHigh;
    private final int recentWindow;

    private final DualRateEwma successTrend;
    private final DualRateEwma weightTrend;
    private final Deque<Long> recentElapsedMs = new ArrayDeque<>();

    private long challengeCount;
    private long acceptedCount;
    private long submittedCount;
    private double responseTimeMs;
    private double errorRate;
    private double hashrateEstimate;
    private long difficultyTarget;
    private int consecutiveAbove;
    private int consecutiveBelow;
    private int challengesSinceAdjustment;
    private double consensusWeight;

    public MinerRecord(String minerId, long firstSeenAt, double alphaLow, double alphaHigh,
                       int recentWindow, long initialDifficultyTarget) {
        this.minerId = Objects.requireNonNull(minerId, "Miner id cannot be null");
        this.firstSeenAt = firstSeenAt;
        this.alphaHigh = alphaHigh;
        this.recentWindow = recentWindow;
        this.successTrend = new DualRateEwma(alphaLow, alphaHigh);
        this.weightTrend = new DualRateEwma(alphaLow, alphaHigh);
        this.difficultyTarget = initialDifficultyTarget;
    }

    private MinerRecord(MinerSnapshot s, double alphaLow, double alphaHigh, int recentWindow) {
        this.minerId = s.getMinerId();
        this.firstSeenAt = s.getFirstSeenAt();
        this.alphaHigh = alphaHigh;
        this.recentWindow = recentWindow;
        this.successTrend = DualRateEwma.restore(alphaLow, alphaHigh,
                s.getSuccessFast(), s.getSuccessSlow(), s.getSuccessSamples());
        this.weightTrend = DualRateEwma.restore(alphaLow, alphaHigh,
                s.getWeightFast(), s.getWeightSlow(), s.getWeightSamples());
        for (Long elapsed : s.getRecentElapsedMs()) {
            pushElapsed(elapsed);
        }
        this.challengeCount = s.getChallengeCount();
        this.acceptedCount = s.getAcceptedCount();
        this.submittedCount = s.getSubmittedCount();
        this.responseTimeMs = s.getResponseTimeMs();
        this.errorRate = s.getErrorRate();
        this.hashrateEstimate = s.getHashrateEstimate();
        this.difficultyTarget = s.getDifficultyTarget();
        this.consecutiveAbove = s.getConsecutiveAbove();
        this.consecutiveBelow = s.getConsecutiveBelow();
        this.challengesSinceAdjustment = s.getChallengesSinceAdjustment();
        this.consensusWeight = s.getConsensusWeight();
    }

    /**
     * 从检查点快照重建
     */
    public static MinerRecord restore(MinerSnapshot snapshot, double alphaLow, double alphaHigh, int recentWindow) {
        return new MinerRecord(snapshot, alphaLow, alphaHigh, recentWindow);
    }

    /**
     * 记录一次挑战结论（计数、响应时间、错误率、算力估计）
     *
     * <p>成功率双速率 EWMA 与难度由 DifficultyController 负责更新。
     */
    public void recordOutcome(VerificationResult result) {
        VerificationOutcome outcome = result.getOutcome();
        challengeCount++;
        if (outcome.isSubmission()) {
            submittedCount++;
        }
        errorRate = ewma(errorRate, outcome == VerificationOutcome.INVALID ? 1.0 : 0.0, challengeCount == 1);
        if (outcome.isAccepted()) {
            acceptedCount++;
            long elapsed = Math.max(0L, result.getElapsedMs());
            responseTimeMs = ewma(responseTimeMs, elapsed, acceptedCount == 1);
            pushElapsed(elapsed);
            double expectedHashes = NONCE_SPACE / (result.getDifficultyTarget() + 1.0);
            double hashrate = expectedHashes / (Math.max(1L, elapsed) / 1000.0);
            hashrateEstimate = ewma(hashrateEstimate, hashrate, acceptedCount == 1);
        }
    }

    private double ewma(double current, double sample, boolean first) {
        return first ? sample : alphaHigh * sample + (1.0 - alphaHigh) * current;
    }

    private void pushElapsed(long elapsed) {
        recentElapsedMs.addLast(elapsed);
        while (recentElapsedMs.size() > recentWindow) {
            recentElapsedMs.removeFirst();
        }
    }

    public MinerSnapshot snapshot() {
        return MinerSnapshot.builder()
                .minerId(minerId)
                .firstSeenAt(firstSeenAt)
                .challengeCount(challengeCount)
                .acceptedCount(acceptedCount)
                .submittedCount(submittedCount)
                .successFast(successTrend.getFast())
                .successSlow(successTrend.getSlow())
                .successSamples(successTrend.getSamples())
                .responseTimeMs(responseTimeMs)
                .errorRate(errorRate)
                .hashrateEstimate(hashrateEstimate)
                .recentElapsedMs(new ArrayList<>(recentElapsedMs))
                .difficultyTarget(difficultyTarget)
                .consecutiveAbove(consecutiveAbove)
                .consecutiveBelow(consecutiveBelow)
                .challengesSinceAdjustment(challengesSinceAdjustment)
                .weightFast(weightTrend.getFast())
                .weightSlow(weightTrend.getSlow())
                .weightSamples(weightTrend.getSamples())
                .consensusWeight(consensusWeight)
                .build();
    }

    public String getMinerId() {
        return minerId;
    }

    public long getFirstSeenAt() {
        return firstSeenAt;
    }

    public long getChallengeCount() {
        return challengeCount;
    }

    public DualRateEwma getSuccessTrend() {
        return successTrend;
    }

    public DualRateEwma getWeightTrend() {
        return weightTrend;
    }

    public long getDifficultyTarget() {
        return difficultyTarget;
    }

    public void setDifficultyTarget(long difficultyTarget) {
        this.difficultyTarget = difficultyTarget;
    }

    public int getConsecutiveAbove() {
        return consecutiveAbove;
    }

    public void setConsecutiveAbove(int consecutiveAbove) {
        this.consecutiveAbove = consecutiveAbove;
    }

    public int getConsecutiveBelow() {
        return consecutiveBelow;
    }

    public void setConsecutiveBelow(int consecutiveBelow) {
        this.consecutiveBelow = consecutiveBelow;
    }

    public int getChallengesSinceAdjustment() {
        return challengesSinceAdjustment;
    }

    public void setChallengesSinceAdjustment(int challengesSinceAdjustment) {
        this.challengesSinceAdjustment = challengesSinceAdjustment;
    }

    public double getConsensusWeight() {
        return consensusWeight;
    }

    public void setConsensusWeight(double consensusWeight) {
        this.consensusWeight = consensusWeight;
    }

    @Override
    public String toString() {
        return "MinerRecord{" +
                "minerId='" + minerId + '\'' +
                ", challenges=" + challengeCount +
                ", accepted=" + acceptedCount +
                ", success=" + successTrend +
                ", target=0x" + Long.toHexString(difficultyTarget) +
                '}';
    }
}
