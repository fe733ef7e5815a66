package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.model.BonusBreakdown;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.MinerSnapshot;
import cn.lihongjie.hashwork.model.Score;
import cn.lihongjie.hashwork.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 评分引擎
 *
 * <p><b>公式</b>：
 * <pre>
 * base  = 1.0（ACCEPTED）或 0.0（其余结论）
 * final = clamp(base × (1 + speed + efficiency + class + historical + consistency + early), 0, capTotal)
 * </pre>
 *
 * <p><b>加成</b>（以基础分比例计，仅对 ACCEPTED 生效）：
 * <ul>
 *   <li>speed：elapsed &lt; speedThreshold 时 cap × (threshold − elapsed) / threshold</li>
 *   <li>efficiency：接受率高于目标时按超出部分线性给出，最多 cap</li>
 *   <li>class：HIGH_DIFFICULTY 固定加成</li>
 *   <li>historical：慢 EWMA 成功率高于阈值且已观察满 trackingPeriod 个挑战</li>
 *   <li>consistency：近期耗时方差低于 maxStdDev² 且快慢趋势差不超过 maxTrendDivergence</li>
 *   <li>early：新矿工（0 &lt; challengeCount &lt; newMinerThreshold）且观测成功率 ≥ performanceThreshold 时，
 *       bondAggressiveness × (1 + 其余加成合计)，即整体放大 (1 + bondAggressiveness) 倍</li>
 * </ul>
 *
 * <p>评分只依赖 (校验结论, 更新前的矿工快照, 配置)，相同输入总得到相同结果，便于争议重放。
 *
 * @author lihongjie
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final ValidatorConfig config;

    public ScoringEngine(ValidatorConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * @param result 校验结论
     * @param snapshot 纳入本次结论之前的矿工快照
     */
    public Score score(VerificationResult result, MinerSnapshot snapshot) {
        Objects.requireNonNull(result, "Verification result cannot be null");
        Objects.requireNonNull(snapshot, "Miner snapshot cannot be null");

        if (!result.isAccepted()) {
            Score zero = new Score(result.getChallengeId(), result.getMinerId(), result.getOutcome(),
                    0.0, BonusBreakdown.NONE, 0.0);
            log.debug("Scored failed challenge: {}", zero);
            return zero;
        }

        double speed = speedBonus(result.getElapsedMs());
        double efficiency = efficiencyBonus(snapshot);
        double challengeClass = classBonus(result.getChallengeClass());
        double historical = historicalBonus(snapshot);
        double consistency = consistencyBonus(snapshot);
        double early = earlyDetectionBonus(snapshot, speed + efficiency + challengeClass + historical + consistency);
        BonusBreakdown bonus = new BonusBreakdown(speed, efficiency, challengeClass, historical, consistency, early);

        double base = 1.0;
        double finalScore = clamp(base * (1.0 + bonus.total()), 0.0, config.getCapTotal());
        Score score = new Score(result.getChallengeId(), result.getMinerId(), result.getOutcome(),
                base, bonus, finalScore);
        log.debug("Scored accepted proof: {}", score);
        return score;
    }

    double speedBonus(long elapsedMs) {
        long threshold = config.getSpeedThresholdMs();
        if (elapsedMs < 0 || elapsedMs >= threshold) {
            return 0.0;
        }
        return config.getSpeedBonusCap() * (threshold - elapsedMs) / (double) threshold;
    }

    double efficiencyBonus(MinerSnapshot snapshot) {
        double ratio = snapshot.acceptanceRatio();
        double target = config.getEfficiencyTarget();
        if (ratio <= target) {
            return 0.0;
        }
        return config.getEfficiencyBonusCap() * Math.min(1.0, (ratio - target) / (1.0 - target));
    }

    double classBonus(ChallengeClass challengeClass) {
        return challengeClass == ChallengeClass.HIGH_DIFFICULTY ? config.getClassBonus() : 0.0;
    }

    double historicalBonus(MinerSnapshot snapshot) {
        boolean matured = snapshot.getChallengeCount() >= config.getTrackingPeriod();
        return matured && snapshot.getSuccessSlow() > config.getHistoricalThreshold()
                ? config.getHistoricalBonus() : 0.0;
    }

    double consistencyBonus(MinerSnapshot snapshot) {
        double variance = snapshot.elapsedVariance();
        if (Double.isNaN(variance)) {
            return 0.0;
        }
        double maxStdDev = config.getConsistencyMaxStdDevMs();
        boolean stable = variance < maxStdDev * maxStdDev;
        boolean steadyTrend = Math.abs(snapshot.trendDivergence()) <= config.getMaxTrendDivergence();
        return stable && steadyTrend ? config.getConsistencyBonus() : 0.0;
    }

    double earlyDetectionBonus(MinerSnapshot snapshot, double otherBonuses) {
        return qualifiesForEarlyBonus(snapshot) ? config.getBondAggressiveness() * (1.0 + otherBonuses) : 0.0;
    }

    /**
     * 早发现奖励条件：仍是新矿工且观测成功率达标；计数到达阈值即取消
     */
    public boolean qualifiesForEarlyBonus(MinerSnapshot snapshot) {
        return snapshot.getChallengeCount() < config.getNewMinerThreshold()
                && snapshot.getChallengeCount() > 0
                && snapshot.observedSuccessRate() >= config.getPerformanceThreshold();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
