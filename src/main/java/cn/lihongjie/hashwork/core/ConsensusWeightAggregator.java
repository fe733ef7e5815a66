package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.model.DualRateEwma;
import cn.lihongjie.hashwork.model.MinerRecord;
import cn.lihongjie.hashwork.model.MinerSnapshot;
import cn.lihongjie.hashwork.model.Score;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 共识权重聚合器（每个 epoch 单写者执行一次）
 *
 * <p><b>流程</b>：
 * <ol>
 *   <li>epochScore = 本 epoch 平均 final / capTotal，送入矿工的权重双速率 EWMA</li>
 *   <li>epochScore ≥ consensusWeightThreshold × 本轮最高分：取快 EWMA，否则取慢 EWMA（持续失败平滑衰减）</li>
 *   <li>challengeCount &lt; newMinerThreshold 且观测成功率 ≥ performanceThreshold：权重 × (1 + bondAggressiveness)</li>
 *   <li>对全部被跟踪矿工归一化到 weightTotal；全为 0 时均分</li>
 * </ol>
 *
 * <p>本 epoch 没有任何评分的矿工不更新趋势，沿用慢 EWMA。
 *
 * @author lihongjie
 */
public class ConsensusWeightAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusWeightAggregator.class);

    private final ValidatorConfig config;
    private final ScoringEngine scoringEngine;
    private long epoch;

    public ConsensusWeightAggregator(ValidatorConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.scoringEngine = new ScoringEngine(config);
    }

    /**
     * 聚合一个 epoch，并把归一化权重写回每条 MinerRecord
     *
     * @param scoresByMiner 本 epoch 的评分，按矿工分组
     * @param records 全部被跟踪的矿工
     */
    public EpochWeights aggregate(Map<String, List<Score>> scoresByMiner, Collection<MinerRecord> records) {
        Objects.requireNonNull(scoresByMiner, "Scores cannot be null");
        Objects.requireNonNull(records, "Records cannot be null");
        long current = ++epoch;

        List<MinerRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(MinerRecord::getMinerId));

        Map<String, Double> epochScores = new LinkedHashMap<>();
        double maxScore = 0.0;
        for (MinerRecord record : ordered) {
            List<Score> scores = scoresByMiner.getOrDefault(record.getMinerId(), Collections.emptyList());
            if (scores.isEmpty()) {
                continue;
            }
            double sum = 0.0;
            for (Score score : scores) {
                sum += score.getFinal();
            }
            double epochScore = sum / scores.size() / config.getCapTotal();
            epochScores.put(record.getMinerId(), epochScore);
            maxScore = Math.max(maxScore, epochScore);
        }

        Map<String, Double> raw = new LinkedHashMap<>();
        Set<String> earlyBonus = new HashSet<>();
        double rawTotal = 0.0;
        for (MinerRecord record : ordered) {
            DualRateEwma trend = record.getWeightTrend();
            Double epochScore = epochScores.get(record.getMinerId());
            double weight;
            if (epochScore == null) {
                weight = trend.getSlow();
            } else {
                trend.update(epochScore);
                boolean inConsensus = epochScore >= config.getConsensusWeightThreshold() * maxScore;
                weight = inConsensus ? trend.getFast() : trend.getSlow();
            }

            MinerSnapshot snapshot = record.snapshot();
            if (qualifiesForEarlyBonus(snapshot)) {
                weight *= 1.0 + config.getBondAggressiveness();
                earlyBonus.add(record.getMinerId());
                log.info("Early-detection bonus applied [miner={}, challenges={}, successRate={}]",
                        record.getMinerId(), snapshot.getChallengeCount(),
                        String.format("%.3f", snapshot.observedSuccessRate()));
            }
            raw.put(record.getMinerId(), weight);
            rawTotal += weight;
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        double total = config.getWeightTotal();
        for (MinerRecord record : ordered) {
            double weight;
            if (rawTotal > 0.0) {
                weight = total * raw.get(record.getMinerId()) / rawTotal;
            } else {
                weight = total / ordered.size();
            }
            record.setConsensusWeight(weight);
            normalized.put(record.getMinerId(), weight);
        }
        if (rawTotal <= 0.0 && !ordered.isEmpty()) {
            log.warn("All raw weights are zero, distributing uniformly [epoch={}, miners={}]", current, ordered.size());
        }

        EpochWeights weights = new EpochWeights(current, normalized, epochScores, earlyBonus);
        log.info("Epoch aggregated [epoch={}, miners={}, scored={}, earlyBonus={}]",
                current, ordered.size(), epochScores.size(), earlyBonus.size());
        log.debug("Epoch weights: {}", weights);
        return weights;
    }

    /**
     * 与评分共用同一条件
     *
     * @see ScoringEngine#qualifiesForEarlyBonus(MinerSnapshot)
     */
    public boolean qualifiesForEarlyBonus(MinerSnapshot snapshot) {
        return scoringEngine.qualifiesForEarlyBonus(snapshot);
    }

    public long getEpoch() {
        return epoch;
    }

    /**
     * 从检查点恢复 epoch 计数
     */
    public void resumeFrom(long epoch) {
        this.epoch = epoch;
    }
}
