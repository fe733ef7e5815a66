package cn.lihongjie.hashwork.model;

/**
 * 双速率指数加权移动平均（一个耦合估计器，不是两个独立指标）
 *
 * <p>算法：
 * <pre>
 * fast = αhigh·x + (1 − αhigh)·fast
 * slow = αlow·x  + (1 − αlow)·slow
 * </pre>
 *
 * <p>每个事件同时更新两条曲线，首个样本直接作为初值。{@code fast - slow} 为趋势信号。
 *
 * @author lihongjie
 */
public class DualRateEwma {

    private final double alphaLow;
    private final double alphaHigh;

    private double fast;
    private double slow;
    private long samples;

    public DualRateEwma(double alphaLow, double alphaHigh) {
        if (!(alphaLow > 0.0 && alphaLow < alphaHigh && alphaHigh < 1.0)) {
            throw new IllegalArgumentException(
                    "Smoothing factors must satisfy 0 < alphaLow < alphaHigh < 1");
        }
        this.alphaLow = alphaLow;
        this.alphaHigh = alphaHigh;
    }

    /**
     * 从检查点恢复
     */
    public static DualRateEwma restore(double alphaLow, double alphaHigh,
                                       double fast, double slow, long samples) {
        DualRateEwma ewma = new DualRateEwma(alphaLow, alphaHigh);
        ewma.fast = fast;
        ewma.slow = slow;
        ewma.samples = samples;
        return ewma;
    }

    public void update(double value) {
        if (samples == 0) {
            fast = value;
            slow = value;
        } else {
            fast = alphaHigh * value + (1.0 - alphaHigh) * fast;
            slow = alphaLow * value + (1.0 - alphaLow) * slow;
        }
        samples++;
    }

    public double getFast() {
        return fast;
    }

    public double getSlow() {
        return slow;
    }

    public long getSamples() {
        return samples;
    }

    /**
     * 趋势信号：正值表示近期好于长期
     */
    public double divergence() {
        return fast - slow;
    }

    @Override
    public String toString() {
        return String.format("DualRateEwma{fast=%.4f, slow=%.4f, samples=%d}", fast, slow, samples);
    }
}
