package cn.lihongjie.hashwork.model;

/**
 * 各项加成明细（以基础分的比例计，0.5 = +50%）
 *
 * @author lihongjie
 */
public class BonusBreakdown {

    public static final BonusBreakdown NONE = new BonusBreakdown(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);

    private final double speed;
    private final double efficiency;
    private final double challengeClass;
    private final double historical;
    private final double consistency;
    private final double earlyDetection;

    public BonusBreakdown(double speed, double efficiency, double challengeClass,
                          double historical, double consistency, double earlyDetection) {
        this.speed = speed;
        this.efficiency = efficiency;
        this.challengeClass = challengeClass;
        this.historical = historical;
        this.consistency = consistency;
        this.earlyDetection = earlyDetection;
    }

    public double getSpeed() {
        return speed;
    }

    public double getEfficiency() {
        return efficiency;
    }

    public double getChallengeClass() {
        return challengeClass;
    }

    public double getHistorical() {
        return historical;
    }

    public double getConsistency() {
        return consistency;
    }

    /**
     * 新矿工早发现加成，为其余各项合计之上的放大部分
     */
    public double getEarlyDetection() {
        return earlyDetection;
    }

    public double total() {
        return speed + efficiency + challengeClass + historical + consistency + earlyDetection;
    }

    @Override
    public String toString() {
        return String.format(
                "Bonus{speed=%.3f, efficiency=%.3f, class=%.3f, historical=%.3f, consistency=%.3f, early=%.3f}",
                speed, efficiency, challengeClass, historical, consistency, earlyDetection);
    }
}
