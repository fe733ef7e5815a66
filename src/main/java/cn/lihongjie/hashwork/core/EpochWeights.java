package cn.lihongjie.hashwork.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 一个 epoch 的权重导出结果：miner_id → 归一化权重
 *
 * @author lihongjie
 */
public class EpochWeights {

    private final long epoch;
    private final Map<String, Double> weights;
    private final Map<String, Double> epochScores;
    private final Set<String> earlyBonusMiners;

    EpochWeights(long epoch, Map<String, Double> weights, Map<String, Double> epochScores,
                 Set<String> earlyBonusMiners) {
        this.epoch = epoch;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.epochScores = Collections.unmodifiableMap(new LinkedHashMap<>(epochScores));
        this.earlyBonusMiners = Collections.unmodifiableSet(new TreeSet<>(earlyBonusMiners));
    }

    public long getEpoch() {
        return epoch;
    }

    /**
     * @return 按 miner_id 排序的权重向量
     */
    public Map<String, Double> getWeights() {
        return weights;
    }

    public double getWeight(String minerId) {
        return weights.getOrDefault(minerId, 0.0);
    }

    /**
     * 本 epoch 内的平均得分（已除以 capTotal，落在 [0, 1]），无评分的矿工不出现
     */
    public Map<String, Double> getEpochScores() {
        return epochScores;
    }

    /**
     * 本 epoch 获得早发现奖励的矿工
     */
    public Set<String> getEarlyBonusMiners() {
        return earlyBonusMiners;
    }

    public double total() {
        double sum = 0.0;
        for (Double w : weights.values()) {
            sum += w;
        }
        return sum;
    }

    @Override
    public String toString() {
        return "EpochWeights{" +
                "epoch=" + epoch +
                ", weights=" + weights +
                ", earlyBonus=" + earlyBonusMiners +
                '}';
    }
}
