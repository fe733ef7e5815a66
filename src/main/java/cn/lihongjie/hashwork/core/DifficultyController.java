package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.DualRateEwma;
import cn.lihongjie.hashwork.model.MinerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 矿工级难度控制器
 *
 * <p><b>策略</b>：
 * <ul>
 *   <li>每个挑战结论同时更新成功率的快 / 慢 EWMA</li>
 *   <li>快 EWMA 连续 trackingPeriod 次高于高性能带：目标 ÷ factor（更难）</li>
 *   <li>快 EWMA 连续 trackingPeriod 次低于低性能带：目标 × factor（更易）</li>
 *   <li>滞回：两次调整之间至少间隔 trackingPeriod 个挑战，调整后计数器全部清零</li>
 *   <li>结果总是夹在 [minDifficultyTarget, maxDifficultyTarget]</li>
 * </ul>
 *
 * <p>矿工记录保存的是 Standard 等价目标，具体类别按基准比例换算。
 * 非线程安全，调用方需保证同一矿工的调用串行。
 *
 * @author lihongjie
 */
public class DifficultyController {

    private static final Logger log = LoggerFactory.getLogger(DifficultyController.class);

    private final ValidatorConfig config;

    public DifficultyController(ValidatorConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * 矿工在指定类别上的有效目标
     */
    public long effectiveTarget(MinerRecord record, ChallengeClass challengeClass) {
        double scaled = record.getDifficultyTarget() * challengeClass.relativeScale();
        return clamp(Math.round(scaled), config);
    }

    /**
     * 记录一次挑战结论（成功 / 失败 / 超时）并按需调整难度
     *
     * @return 本次是否发生了难度调整
     */
    public boolean observe(MinerRecord record, boolean success) {
        ValidatorConfig cfg = this.config;
        DualRateEwma trend = record.getSuccessTrend();
        trend.update(success ? 1.0 : 0.0);

        double fast = trend.getFast();
        record.setConsecutiveAbove(fast > cfg.getHighPerformanceBand() ? record.getConsecutiveAbove() + 1 : 0);
        record.setConsecutiveBelow(fast < cfg.getLowPerformanceBand() ? record.getConsecutiveBelow() + 1 : 0);
        record.setChallengesSinceAdjustment(record.getChallengesSinceAdjustment() + 1);

        int period = cfg.getTrackingPeriod();
        if (record.getChallengesSinceAdjustment() < period) {
            return false;
        }

        long current = record.getDifficultyTarget();
        long next;
        if (record.getConsecutiveAbove() >= period) {
            next = clamp(Math.round(current / cfg.getDifficultyAdjustmentFactor()), cfg);
        } else if (record.getConsecutiveBelow() >= period) {
            next = clamp(Math.round(current * cfg.getDifficultyAdjustmentFactor()), cfg);
        } else {
            return false;
        }

        record.setConsecutiveAbove(0);
        record.setConsecutiveBelow(0);
        record.setChallengesSinceAdjustment(0);
        if (next == current) {
            log.debug("Difficulty already at bound [miner={}, target=0x{}]",
                    record.getMinerId(), Long.toHexString(current));
            return false;
        }
        record.setDifficultyTarget(next);
        log.info("Adjusted difficulty [miner={}, target=0x{} -> 0x{}, fast={}, slow={}]",
                record.getMinerId(), Long.toHexString(current), Long.toHexString(next),
                String.format("%.3f", fast), String.format("%.3f", trend.getSlow()));
        return true;
    }

    /**
     * 快慢 EWMA 之差，正值表示近期表现优于长期水平
     */
    public double trendSignal(MinerRecord record) {
        return record.getSuccessTrend().divergence();
    }

    static long clamp(long target, ValidatorConfig config) {
        return Math.max(config.getMinDifficultyTarget(), Math.min(config.getMaxDifficultyTarget(), target));
    }
}
