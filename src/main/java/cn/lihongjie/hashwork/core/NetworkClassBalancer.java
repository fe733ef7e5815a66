package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.DualRateEwma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 全网类别配比调节
 *
 * <p><b>策略</b>：
 * <ul>
 *   <li>所有矿工的挑战结论汇入一条全网成功率 EWMA（取慢速值）</li>
 *   <li>高于 highPerformanceBand：networkClassShift 的权重从 standard 移到 high_difficulty</li>
 *   <li>低于 lowPerformanceBand：同样大小的权重从 high_difficulty 移回 standard</li>
 *   <li>移动量不超过来源类别的基准权重，总和不变</li>
 *   <li>只在所处区间变化时通知监听方（在锁内调用，通知顺序与变化顺序一致）</li>
 * </ul>
 *
 * @author lihongjie
 */
public class NetworkClassBalancer {

    private static final Logger log = LoggerFactory.getLogger(NetworkClassBalancer.class);

    public enum Band {
        LOW, NORMAL, HIGH
    }

    private final ValidatorConfig config;
    private final DualRateEwma successRate;
    private final Consumer<Map<ChallengeClass, Double>> listener;
    private Map<ChallengeClass, Double> baseWeights;
    private Map<ChallengeClass, Double> weights;
    private Band band = Band.NORMAL;

    /**
     * @param listener 权重变化回调（如重建抽样表）
     */
    public NetworkClassBalancer(ValidatorConfig config, Consumer<Map<ChallengeClass, Double>> listener) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
        this.successRate = new DualRateEwma(config.getAlphaLow(), config.getAlphaHigh());
        this.baseWeights = config.getClassWeights();
        this.weights = baseWeights;
    }

    /**
     * 记录一次挑战结论
     *
     * @return 本次是否改变了类别权重
     */
    public synchronized boolean observe(boolean success) {
        successRate.update(success ? 1.0 : 0.0);
        if (config.getNetworkClassShift() <= 0.0) {
            return false;
        }
        Band next = bandOf(successRate.getSlow());
        if (next == band) {
            return false;
        }
        log.info("Network success band changed [from={}, to={}, successRate={}]",
                band, next, String.format("%.3f", successRate.getSlow()));
        band = next;
        weights = shifted(baseWeights, band, config.getNetworkClassShift());
        listener.accept(weights);
        return true;
    }

    /**
     * 替换基准权重，按当前区间重新计算并通知
     */
    public synchronized void rebase(Map<ChallengeClass, Double> updated) {
        this.baseWeights = Collections.unmodifiableMap(new EnumMap<>(updated));
        this.weights = config.getNetworkClassShift() > 0.0
                ? shifted(baseWeights, band, config.getNetworkClassShift())
                : baseWeights;
        listener.accept(weights);
    }

    private Band bandOf(double rate) {
        if (rate > config.getHighPerformanceBand()) {
            return Band.HIGH;
        }
        if (rate < config.getLowPerformanceBand()) {
            return Band.LOW;
        }
        return Band.NORMAL;
    }

    static Map<ChallengeClass, Double> shifted(Map<ChallengeClass, Double> base, Band band, double shift) {
        if (band == Band.NORMAL) {
            return base;
        }
        ChallengeClass from = band == Band.HIGH ? ChallengeClass.STANDARD : ChallengeClass.HIGH_DIFFICULTY;
        ChallengeClass to = band == Band.HIGH ? ChallengeClass.HIGH_DIFFICULTY : ChallengeClass.STANDARD;
        Map<ChallengeClass, Double> result = new EnumMap<>(base);
        double available = result.getOrDefault(from, 0.0);
        double moved = Math.min(shift, available);
        result.put(from, available - moved);
        result.put(to, result.getOrDefault(to, 0.0) + moved);
        return Collections.unmodifiableMap(result);
    }

    public synchronized Band getBand() {
        return band;
    }

    public synchronized Map<ChallengeClass, Double> getWeights() {
        return weights;
    }

    public synchronized double getSuccessRate() {
        return successRate.getSlow();
    }
}
