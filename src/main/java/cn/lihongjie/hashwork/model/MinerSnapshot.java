package cn.lihongjie.hashwork.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 矿工滚动状态的不可变快照
 *
 * <p>两个用途：
 * <ul>
 *   <li>评分输入：评分只依赖 (校验结论, 快照, 配置)，可重放审计</li>
 *   <li>检查点单元：序列化后持久化，重启后恢复趋势状态</li>
 * </ul>
 *
 * @author lihongjie
 */
@JsonDeserialize(builder = MinerSnapshot.Builder.class)
public final class MinerSnapshot {

    private final String minerId;
    private final long firstSeenAt;
    private final long challengeCount;
    private final long acceptedCount;
    private final long submittedCount;
    private final double successFast;
    private final double successSlow;
    private final long successSamples;
    private final double responseTimeMs;
    private final double errorRate;
    private final double hashrateEstimate;
    private final List<Long> recentElapsedMs;
    private final long difficultyTarget;
    private final int consecutiveAbove;
    private final int consecutiveBelow;
    private final int challengesSinceAdjustment;
    private final double weightFast;
    private final double weightSlow;
    private final long weightSamples;
    private final double consensusWeight;

    private MinerSnapshot(Builder b) {
        this.minerId = b.minerId;
        this.firstSeenAt = b.firstSeenAt;
        this.challengeCount = b.challengeCount;
        this.acceptedCount = b.acceptedCount;
        this.submittedCount = b.submittedCount;
        this.successFast = b.successFast;
        this.successSlow = b.successSlow;
        this.successSamples = b.successSamples;
        this.responseTimeMs = b.responseTimeMs;
        this.errorRate = b.errorRate;
        this.hashrateEstimate = b.hashrateEstimate;
        this.recentElapsedMs = Collections.unmodifiableList(new ArrayList<>(b.recentElapsedMs));
        this.difficultyTarget = b.difficultyTarget;
        this.consecutiveAbove = b.consecutiveAbove;
        this.consecutiveBelow = b.consecutiveBelow;
        this.challengesSinceAdjustment = b.challengesSinceAdjustment;
        this.weightFast = b.weightFast;
        this.weightSlow = b.weightSlow;
        this.weightSamples = b.weightSamples;
        this.consensusWeight = b.consensusWeight;
    }

    public static Builder builder() {
        return new Builder();
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

    public long getAcceptedCount() {
        return acceptedCount;
    }

    public long getSubmittedCount() {
        return submittedCount;
    }

    public double getSuccessFast() {
        return successFast;
    }

    public double getSuccessSlow() {
        return successSlow;
    }

    public long getSuccessSamples() {
        return successSamples;
    }

    public double getResponseTimeMs() {
        return responseTimeMs;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public double getHashrateEstimate() {
        return hashrateEstimate;
    }

    public List<Long> getRecentElapsedMs() {
        return recentElapsedMs;
    }

    public long getDifficultyTarget() {
        return difficultyTarget;
    }

    public int getConsecutiveAbove() {
        return consecutiveAbove;
    }

    public int getConsecutiveBelow() {
        return consecutiveBelow;
    }

    public int getChallengesSinceAdjustment() {
        return challengesSinceAdjustment;
    }

    public double getWeightFast() {
        return weightFast;
    }

    public double getWeightSlow() {
        return weightSlow;
    }

    public long getWeightSamples() {
        return weightSamples;
    }

    public double getConsensusWeight() {
        return consensusWeight;
    }

    /**
     * 实际观测成功率 accepted / challenges，无记录时为 0
     */
    public double observedSuccessRate() {
        return challengeCount == 0 ? 0.0 : (double) acceptedCount / challengeCount;
    }

    /**
     * 提交接受率 accepted / submitted，无提交时为 0
     */
    public double acceptanceRatio() {
        return submittedCount == 0 ? 0.0 : (double) acceptedCount / submittedCount;
    }

    /**
     * 近期耗时的总体方差，样本不足 2 个时返回 NaN
     */
    public double elapsedVariance() {
        int n = recentElapsedMs.size();
        if (n < 2) {
            return Double.NaN;
        }
        double mean = 0.0;
        for (Long v : recentElapsedMs) {
            mean += v;
        }
        mean /= n;
        double sq = 0.0;
        for (Long v : recentElapsedMs) {
            double d = v - mean;
            sq += d * d;
        }
        return sq / n;
    }

    public double trendDivergence() {
        return successFast - successSlow;
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String minerId;
        private long firstSeenAt;
        private long challengeCount;
        private long acceptedCount;
        private long submittedCount;
        private double successFast;
        private double successSlow;
        private long successSamples;
        private double responseTimeMs;
        private double errorRate;
        private double hashrateEstimate;
        private List<Long> recentElapsedMs = new ArrayList<>();
        private long difficultyTarget;
        private int consecutiveAbove;
        private int consecutiveBelow;
        private int challengesSinceAdjustment;
        private double weightFast;
        private double weightSlow;
        private long weightSamples;
        private double consensusWeight;

        public Builder minerId(String minerId) {
            this.minerId = minerId;
            return this;
        }

        public Builder firstSeenAt(long firstSeenAt) {
            this.firstSeenAt = firstSeenAt;
            return this;
        }

        public Builder challengeCount(long challengeCount) {
            this.challengeCount = challengeCount;
            return this;
        }

        public Builder acceptedCount(long acceptedCount) {
            this.acceptedCount = acceptedCount;
            return this;
        }

        public Builder submittedCount(long submittedCount) {
            this.submittedCount = submittedCount;
            return this;
        }

        public Builder successFast(double successFast) {
            this.successFast = successFast;
            return this;
        }

        public Builder successSlow(double successSlow) {
            this.successSlow = successSlow;
            return this;
        }

        public Builder successSamples(long successSamples) {
            this.successSamples = successSamples;
            return this;
        }

        public Builder responseTimeMs(double responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder hashrateEstimate(double hashrateEstimate) {
            this.hashrateEstimate = hashrateEstimate;
            return this;
        }

        public Builder recentElapsedMs(List<Long> recentElapsedMs) {
            this.recentElapsedMs = recentElapsedMs == null ? new ArrayList<>() : recentElapsedMs;
            return this;
        }

        public Builder difficultyTarget(long difficultyTarget) {
            this.difficultyTarget = difficultyTarget;
            return this;
        }

        public Builder consecutiveAbove(int consecutiveAbove) {
            this.consecutiveAbove = consecutiveAbove;
            return this;
        }

        public Builder consecutiveBelow(int consecutiveBelow) {
            this.consecutiveBelow = consecutiveBelow;
            return this;
        }

        public Builder challengesSinceAdjustment(int challengesSinceAdjustment) {
            this.challengesSinceAdjustment = challengesSinceAdjustment;
            return this;
        }

        public Builder weightFast(double weightFast) {
            this.weightFast = weightFast;
            return this;
        }

        public Builder weightSlow(double weightSlow) {
            this.weightSlow = weightSlow;
            return this;
        }

        public Builder weightSamples(long weightSamples) {
            this.weightSamples = weightSamples;
            return this;
        }

        public Builder consensusWeight(double consensusWeight) {
            this.consensusWeight = consensusWeight;
            return this;
        }

        public MinerSnapshot build() {
            return new MinerSnapshot(this);
        }
    }

    @Override
    public String toString() {
        return "MinerSnapshot{" +
                "minerId='" + minerId + '\'' +
                ", challenges=" + challengeCount +
                ", accepted=" + acceptedCount +
                ", submitted=" + submittedCount +
                String.format(", success=[fast=%.3f, slow=%.3f]", successFast, successSlow) +
                ", target=0x" + Long.toHexString(difficultyTarget) +
                String.format(", weight=%.4f", consensusWeight) +
                '}';
    }
}
