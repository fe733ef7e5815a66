package cn.lihongjie.hashwork.config;

import cn.lihongjie.hashwork.exception.HashWorkException;
import cn.lihongjie.hashwork.model.ChallengeClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * 验证方配置（不可变）
 *
 * <p>默认值：
 * <ul>
 *   <li>alphaLow / alphaHigh: 0.1 / 0.8（慢 / 快 EWMA 平滑因子）</li>
 *   <li>trackingPeriod: 10（难度调整滞回窗口）</li>
 *   <li>newMinerThreshold: 5，performanceThreshold: 0.8，bondAggressiveness: 0.3（早发现奖励）</li>
 *   <li>类别权重：standard 0.4 / high_difficulty 0.2 / time_pressure 0.2 / efficiency_test 0.2</li>
 *   <li>networkClassShift: 0.2（全网成功率越过高 / 低性能带时在 standard 与 high_difficulty 间移动的权重）</li>
 *   <li>难度目标区间：[0x000000ff, 0x00ffffff]</li>
 *   <li>奖励上限：speed 50%，efficiency 30%，class 50%，historical 20%，consistency 15%，总分上限 2.5</li>
 * </ul>
 *
 * <p>类别权重之和不为 1 时自动归一化。
 *
 * @author lihongjie
 */
public final class ValidatorConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidatorConfig.class);

    public static final String DEFAULT_RESOURCE = "hashwork-validator.properties";

    private final double alphaLow;
    private final double alphaHigh;
    private final int trackingPeriod;
    private final double consensusWeightThreshold;
    private final int newMinerThreshold;
    private final double performanceThreshold;
    private final double bondAggressiveness;
    private final Map<ChallengeClass, Double> classWeights;
    private final double networkClassShift;
    private final long minDifficultyTarget;
    private final long maxDifficultyTarget;
    private final long initialDifficultyTarget;
    private final double difficultyAdjustmentFactor;
    private final double highPerformanceBand;
    private final double lowPerformanceBand;
    private final long gracePeriodMillis;
    private final long speedThresholdMs;
    private final double efficiencyTarget;
    private final double historicalThreshold;
    private final double consistencyMaxStdDevMs;
    private final double maxTrendDivergence;
    private final int recentWindow;
    private final double speedBonusCap;
    private final double efficiencyBonusCap;
    private final double classBonus;
    private final double historicalBonus;
    private final double consistencyBonus;
    private final double capTotal;
    private final double weightTotal;
    private final long checkpointIntervalMillis;

    private ValidatorConfig(Builder b) {
        this.alphaLow = b.alphaLow;
        this.alphaHigh = b.alphaHigh;
        this.trackingPeriod = b.trackingPeriod;
        this.consensusWeightThreshold = b.consensusWeightThreshold;
        this.newMinerThreshold = b.newMinerThreshold;
        this.performanceThreshold = b.performanceThreshold;
        this.bondAggressiveness = b.bondAggressiveness;
        this.classWeights = Collections.unmodifiableMap(normalize(b.classWeights));
        this.networkClassShift = b.networkClassShift;
        this.minDifficultyTarget = b.minDifficultyTarget;
        this.maxDifficultyTarget = b.maxDifficultyTarget;
        this.initialDifficultyTarget = b.initialDifficultyTarget;
        this.difficultyAdjustmentFactor = b.difficultyAdjustmentFactor;
        this.highPerformanceBand = b.highPerformanceBand;
        this.lowPerformanceBand = b.lowPerformanceBand;
        this.gracePeriodMillis = b.gracePeriodMillis;
        this.speedThresholdMs = b.speedThresholdMs;
        this.efficiencyTarget = b.efficiencyTarget;
        this.historicalThreshold = b.historicalThreshold;
        this.consistencyMaxStdDevMs = b.consistencyMaxStdDevMs;
        this.maxTrendDivergence = b.maxTrendDivergence;
        this.recentWindow = b.recentWindow;
        this.speedBonusCap = b.speedBonusCap;
        this.efficiencyBonusCap = b.efficiencyBonusCap;
        this.classBonus = b.classBonus;
        this.historicalBonus = b.historicalBonus;
        this.consistencyBonus = b.consistencyBonus;
        this.capTotal = b.capTotal;
        this.weightTotal = b.weightTotal;
        this.checkpointIntervalMillis = b.checkpointIntervalMillis;
    }

    public static ValidatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 从 classpath 资源加载，资源不存在时使用默认值
     */
    public static ValidatorConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = ValidatorConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("Validator config resource not found, using defaults [resource={}]", resource);
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new HashWorkException("Failed to read validator config: " + resource, e);
        }
        return fromProperties(properties);
    }

    /**
     * 从 {@code validator.*} 键读取配置，未出现的键保留默认值，未知键忽略
     */
    public static ValidatorConfig fromProperties(Properties p) {
        Builder b = builder();
        b.alphaLow(dbl(p, "validator.alpha-low", b.alphaLow));
        b.alphaHigh(dbl(p, "validator.alpha-high", b.alphaHigh));
        b.trackingPeriod(integer(p, "validator.tracking-period", b.trackingPeriod));
        b.consensusWeightThreshold(dbl(p, "validator.consensus-weight-threshold", b.consensusWeightThreshold));
        b.newMinerThreshold(integer(p, "validator.new-miner-threshold", b.newMinerThreshold));
        b.performanceThreshold(dbl(p, "validator.performance-threshold", b.performanceThreshold));
        b.bondAggressiveness(dbl(p, "validator.bond-aggressiveness", b.bondAggressiveness));
        for (ChallengeClass cls : ChallengeClass.values()) {
            b.classWeight(cls, dbl(p, "validator.class-weight." + cls.getCode(), b.classWeights.get(cls)));
        }
        b.networkClassShift(dbl(p, "validator.network-class-shift", b.networkClassShift));
        b.difficultyBounds(
                lng(p, "validator.min-difficulty-target", b.minDifficultyTarget),
                lng(p, "validator.max-difficulty-target", b.maxDifficultyTarget));
        b.initialDifficultyTarget(lng(p, "validator.initial-difficulty-target", b.initialDifficultyTarget));
        b.difficultyAdjustmentFactor(dbl(p, "validator.difficulty-adjustment-factor", b.difficultyAdjustmentFactor));
        b.performanceBands(
                dbl(p, "validator.low-performance-band", b.lowPerformanceBand),
                dbl(p, "validator.high-performance-band", b.highPerformanceBand));
        b.gracePeriodMillis(lng(p, "validator.grace-period-ms", b.gracePeriodMillis));
        b.speedThresholdMs(lng(p, "validator.speed-threshold-ms", b.speedThresholdMs));
        b.efficiencyTarget(dbl(p, "validator.efficiency-target", b.efficiencyTarget));
        b.historicalThreshold(dbl(p, "validator.historical-threshold", b.historicalThreshold));
        b.consistencyMaxStdDevMs(dbl(p, "validator.consistency-max-stddev-ms", b.consistencyMaxStdDevMs));
        b.maxTrendDivergence(dbl(p, "validator.max-trend-divergence", b.maxTrendDivergence));
        b.recentWindow(integer(p, "validator.recent-window", b.recentWindow));
        b.capTotal(dbl(p, "validator.cap-total", b.capTotal));
        b.weightTotal(dbl(p, "validator.weight-total", b.weightTotal));
        b.checkpointIntervalMillis(lng(p, "validator.checkpoint-interval-ms", b.checkpointIntervalMillis));
        return b.build();
    }

    private static double dbl(Properties p, String key, double fallback) {
        String value = p.getProperty(key);
        return value == null ? fallback : Double.parseDouble(value.trim());
    }

    private static int integer(Properties p, String key, int fallback) {
        String value = p.getProperty(key);
        return value == null ? fallback : Integer.parseInt(value.trim());
    }

    private static long lng(Properties p, String key, long fallback) {
        String value = p.getProperty(key);
        if (value == null) {
            return fallback;
        }
        String v = value.trim();
        return v.startsWith("0x") ? Long.parseLong(v.substring(2), 16) : Long.parseLong(v);
    }

    private static Map<ChallengeClass, Double> normalize(Map<ChallengeClass, Double> weights) {
        double sum = 0.0;
        for (Double w : weights.values()) {
            sum += w;
        }
        Map<ChallengeClass, Double> normalized = new EnumMap<>(ChallengeClass.class);
        for (Map.Entry<ChallengeClass, Double> entry : weights.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / sum);
        }
        if (Math.abs(sum - 1.0) > 1e-9) {
            log.warn("Challenge class weights sum to {}, renormalized to {}", sum, normalized);
        }
        return normalized;
    }

    public double getAlphaLow() {
        return alphaLow;
    }

    public double getAlphaHigh() {
        return alphaHigh;
    }

    public int getTrackingPeriod() {
        return trackingPeriod;
    }

    public double getConsensusWeightThreshold() {
        return consensusWeightThreshold;
    }

    public int getNewMinerThreshold() {
        return newMinerThreshold;
    }

    public double getPerformanceThreshold() {
        return performanceThreshold;
    }

    public double getBondAggressiveness() {
        return bondAggressiveness;
    }

    /**
     * @return 归一化后的类别权重（和为 1）
     */
    public Map<ChallengeClass, Double> getClassWeights() {
        return classWeights;
    }

    public long getMinDifficultyTarget() {
        return minDifficultyTarget;
    }

    public long getMaxDifficultyTarget() {
        return maxDifficultyTarget;
    }

    public long getInitialDifficultyTarget() {
        return initialDifficultyTarget;
    }

    public double getDifficultyAdjustmentFactor() {
        return difficultyAdjustmentFactor;
    }

    public double getNetworkClassShift() {
        return networkClassShift;
    }

    public double getHighPerformanceBand() {
        return highPerformanceBand;
    }

    public double getLowPerformanceBand() {
        return lowPerformanceBand;
    }

    public long getGracePeriodMillis() {
        return gracePeriodMillis;
    }

    public long getSpeedThresholdMs() {
        return speedThresholdMs;
    }

    public double getEfficiencyTarget() {
        return efficiencyTarget;
    }

    public double getHistoricalThreshold() {
        return historicalThreshold;
    }

    public double getConsistencyMaxStdDevMs() {
        return consistencyMaxStdDevMs;
    }

    public double getMaxTrendDivergence() {
        return maxTrendDivergence;
    }

    public int getRecentWindow() {
        return recentWindow;
    }

    public double getSpeedBonusCap() {
        return speedBonusCap;
    }

    public double getEfficiencyBonusCap() {
        return efficiencyBonusCap;
    }

    public double getClassBonus() {
        return classBonus;
    }

    public double getHistoricalBonus() {
        return historicalBonus;
    }

    public double getConsistencyBonus() {
        return consistencyBonus;
    }

    public double getCapTotal() {
        return capTotal;
    }

    public double getWeightTotal() {
        return weightTotal;
    }

    public long getCheckpointIntervalMillis() {
        return checkpointIntervalMillis;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.alphaLow = alphaLow;
        b.alphaHigh = alphaHigh;
        b.trackingPeriod = trackingPeriod;
        b.consensusWeightThreshold = consensusWeightThreshold;
        b.newMinerThreshold = newMinerThreshold;
        b.performanceThreshold = performanceThreshold;
        b.bondAggressiveness = bondAggressiveness;
        b.classWeights.putAll(classWeights);
        b.networkClassShift = networkClassShift;
        b.minDifficultyTarget = minDifficultyTarget;
        b.maxDifficultyTarget = maxDifficultyTarget;
        b.initialDifficultyTarget = initialDifficultyTarget;
        b.difficultyAdjustmentFactor = difficultyAdjustmentFactor;
        b.highPerformanceBand = highPerformanceBand;
        b.lowPerformanceBand = lowPerformanceBand;
        b.gracePeriodMillis = gracePeriodMillis;
        b.speedThresholdMs = speedThresholdMs;
        b.efficiencyTarget = efficiencyTarget;
        b.historicalThreshold = historicalThreshold;
        b.consistencyMaxStdDevMs = consistencyMaxStdDevMs;
        b.maxTrendDivergence = maxTrendDivergence;
        b.recentWindow = recentWindow;
        b.speedBonusCap = speedBonusCap;
        b.efficiencyBonusCap = efficiencyBonusCap;
        b.classBonus = classBonus;
        b.historicalBonus = historicalBonus;
        b.consistencyBonus = consistencyBonus;
        b.capTotal = capTotal;
        b.weightTotal = weightTotal;
        b.checkpointIntervalMillis = checkpointIntervalMillis;
        return b;
    }

    public static class Builder {
        private double alphaLow = 0.1;
        private double alphaHigh = 0.8;
        private int trackingPeriod = 10;
        private double consensusWeightThreshold = 0.8;
        private int newMinerThreshold = 5;
        private double performanceThreshold = 0.8;
        private double bondAggressiveness = 0.3;
        private final Map<ChallengeClass, Double> classWeights = new EnumMap<>(ChallengeClass.class);
        private double networkClassShift = 0.2;
        private long minDifficultyTarget = 0x000000ffL;
        private long maxDifficultyTarget = 0x00ffffffL;
        private long initialDifficultyTarget = ChallengeClass.STANDARD.getBaseTarget();
        private double difficultyAdjustmentFactor = 1.1;
        private double highPerformanceBand = 0.8;
        private double lowPerformanceBand = 0.3;
        private long gracePeriodMillis = 2_000L;
        private long speedThresholdMs = 5_000L;
        private double efficiencyTarget = 0.8;
        private double historicalThreshold = 0.8;
        private double consistencyMaxStdDevMs = 1_000.0;
        private double maxTrendDivergence = 0.25;
        private int recentWindow = 10;
        private double speedBonusCap = 0.5;
        private double efficiencyBonusCap = 0.3;
        private double classBonus = 0.5;
        private double historicalBonus = 0.2;
        private double consistencyBonus = 0.15;
        private double capTotal = 2.5;
        private double weightTotal = 1.0;
        private long checkpointIntervalMillis = 60_000L;

        private Builder() {
            classWeights.put(ChallengeClass.STANDARD, 0.4);
            classWeights.put(ChallengeClass.HIGH_DIFFICULTY, 0.2);
            classWeights.put(ChallengeClass.TIME_PRESSURE, 0.2);
            classWeights.put(ChallengeClass.EFFICIENCY_TEST, 0.2);
        }

        public Builder alphaLow(double alphaLow) {
            this.alphaLow = alphaLow;
            return this;
        }

        public Builder alphaHigh(double alphaHigh) {
            this.alphaHigh = alphaHigh;
            return this;
        }

        public Builder trackingPeriod(int trackingPeriod) {
            this.trackingPeriod = trackingPeriod;
            return this;
        }

        public Builder consensusWeightThreshold(double consensusWeightThreshold) {
            this.consensusWeightThreshold = consensusWeightThreshold;
            return this;
        }

        public Builder newMinerThreshold(int newMinerThreshold) {
            this.newMinerThreshold = newMinerThreshold;
            return this;
        }

        public Builder performanceThreshold(double performanceThreshold) {
            this.performanceThreshold = performanceThreshold;
            return this;
        }

        public Builder bondAggressiveness(double bondAggressiveness) {
            this.bondAggressiveness = bondAggressiveness;
            return this;
        }

        public Builder classWeight(ChallengeClass challengeClass, double weight) {
            this.classWeights.put(challengeClass, weight);
            return this;
        }

        /**
         * 0 表示关闭全网类别配比调节
         */
        public Builder networkClassShift(double networkClassShift) {
            this.networkClassShift = networkClassShift;
            return this;
        }

        public Builder difficultyBounds(long minDifficultyTarget, long maxDifficultyTarget) {
            this.minDifficultyTarget = minDifficultyTarget;
            this.maxDifficultyTarget = maxDifficultyTarget;
            return this;
        }

        public Builder initialDifficultyTarget(long initialDifficultyTarget) {
            this.initialDifficultyTarget = initialDifficultyTarget;
            return this;
        }

        public Builder difficultyAdjustmentFactor(double difficultyAdjustmentFactor) {
            this.difficultyAdjustmentFactor = difficultyAdjustmentFactor;
            return this;
        }

        public Builder performanceBands(double lowPerformanceBand, double highPerformanceBand) {
            this.lowPerformanceBand = lowPerformanceBand;
            this.highPerformanceBand = highPerformanceBand;
            return this;
        }

        public Builder gracePeriodMillis(long gracePeriodMillis) {
            this.gracePeriodMillis = gracePeriodMillis;
            return this;
        }

        public Builder speedThresholdMs(long speedThresholdMs) {
            this.speedThresholdMs = speedThresholdMs;
            return this;
        }

        public Builder efficiencyTarget(double efficiencyTarget) {
            this.efficiencyTarget = efficiencyTarget;
            return this;
        }

        public Builder historicalThreshold(double historicalThreshold) {
            this.historicalThreshold = historicalThreshold;
            return this;
        }

        public Builder consistencyMaxStdDevMs(double consistencyMaxStdDevMs) {
            this.consistencyMaxStdDevMs = consistencyMaxStdDevMs;
            return this;
        }

        public Builder maxTrendDivergence(double maxTrendDivergence) {
            this.maxTrendDivergence = maxTrendDivergence;
            return this;
        }

        public Builder recentWindow(int recentWindow) {
            this.recentWindow = recentWindow;
            return this;
        }

        public Builder bonusCaps(double speed, double efficiency, double challengeClass,
                                 double historical, double consistency) {
            this.speedBonusCap = speed;
            this.efficiencyBonusCap = efficiency;
            this.classBonus = challengeClass;
            this.historicalBonus = historical;
            this.consistencyBonus = consistency;
            return this;
        }

        public Builder capTotal(double capTotal) {
            this.capTotal = capTotal;
            return this;
        }

        public Builder weightTotal(double weightTotal) {
            this.weightTotal = weightTotal;
            return this;
        }

        public Builder checkpointIntervalMillis(long checkpointIntervalMillis) {
            this.checkpointIntervalMillis = checkpointIntervalMillis;
            return this;
        }

        public ValidatorConfig build() {
            if (!(alphaLow > 0.0 && alphaLow < alphaHigh && alphaHigh < 1.0)) {
                throw new IllegalArgumentException("Must satisfy 0 < alphaLow < alphaHigh < 1");
            }
            if (trackingPeriod < 1) {
                throw new IllegalArgumentException("Tracking period must be >= 1");
            }
            if (newMinerThreshold < 0) {
                throw new IllegalArgumentException("New miner threshold must be >= 0");
            }
            requireUnit("consensusWeightThreshold", consensusWeightThreshold);
            requireUnit("performanceThreshold", performanceThreshold);
            requireUnit("highPerformanceBand", highPerformanceBand);
            requireUnit("lowPerformanceBand", lowPerformanceBand);
            requireUnit("historicalThreshold", historicalThreshold);
            requireUnit("networkClassShift", networkClassShift);
            if (!(efficiencyTarget >= 0.0 && efficiencyTarget < 1.0)) {
                throw new IllegalArgumentException("Efficiency target must be in [0, 1)");
            }
            if (lowPerformanceBand >= highPerformanceBand) {
                throw new IllegalArgumentException("Low performance band must be below high band");
            }
            if (bondAggressiveness < 0.0) {
                throw new IllegalArgumentException("Bond aggressiveness must be >= 0");
            }
            double sum = 0.0;
            for (Double w : classWeights.values()) {
                if (w == null || w < 0.0 || Double.isNaN(w)) {
                    throw new IllegalArgumentException("Challenge class weights must be >= 0");
                }
                sum += w;
            }
            if (sum <= 0.0) {
                throw new IllegalArgumentException("At least one challenge class weight must be positive");
            }
            if (minDifficultyTarget <= 0 || maxDifficultyTarget < minDifficultyTarget
                    || maxDifficultyTarget > 0xffffffffL) {
                throw new IllegalArgumentException(
                        "Difficulty bounds must satisfy 0 < min <= max <= 0xffffffff");
            }
            if (initialDifficultyTarget < minDifficultyTarget || initialDifficultyTarget > maxDifficultyTarget) {
                throw new IllegalArgumentException("Initial difficulty target must lie within bounds");
            }
            if (difficultyAdjustmentFactor <= 1.0) {
                throw new IllegalArgumentException("Difficulty adjustment factor must be > 1");
            }
            if (gracePeriodMillis < 0 || speedThresholdMs <= 0) {
                throw new IllegalArgumentException("Grace period must be >= 0 and speed threshold > 0");
            }
            if (recentWindow < 2) {
                throw new IllegalArgumentException("Recent window must hold at least 2 samples");
            }
            if (speedBonusCap < 0 || efficiencyBonusCap < 0 || classBonus < 0
                    || historicalBonus < 0 || consistencyBonus < 0) {
                throw new IllegalArgumentException("Bonus caps must be >= 0");
            }
            if (capTotal < 1.0) {
                throw new IllegalArgumentException("Total cap must be >= 1 (the base score)");
            }
            if (weightTotal <= 0.0) {
                throw new IllegalArgumentException("Weight total must be positive");
            }
            if (checkpointIntervalMillis <= 0) {
                throw new IllegalArgumentException("Checkpoint interval must be positive");
            }
            return new ValidatorConfig(this);
        }

        private static void requireUnit(String name, double value) {
            if (!(value >= 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException(name + " must be in [0, 1]");
            }
        }
    }

    @Override
    public String toString() {
        return "ValidatorConfig{" +
                "alphaLow=" + alphaLow +
                ", alphaHigh=" + alphaHigh +
                ", trackingPeriod=" + trackingPeriod +
                ", newMinerThreshold=" + newMinerThreshold +
                ", performanceThreshold=" + performanceThreshold +
                ", bondAggressiveness=" + bondAggressiveness +
                ", classWeights=" + classWeights +
                ", networkClassShift=" + networkClassShift +
                ", difficulty=[0x" + Long.toHexString(minDifficultyTarget) +
                ", 0x" + Long.toHexString(maxDifficultyTarget) + "]" +
                ", capTotal=" + capTotal +
                '}';
    }
}
