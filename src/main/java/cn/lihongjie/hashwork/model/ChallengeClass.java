package cn.lihongjie.hashwork.model;

/**
 * Challenge 类别及其基准参数
 *
 * <p>目标值为 32 位压缩目标（越小越难），展开规则见 {@code ProofHash}。
 *
 * @author lihongjie
 */
public enum ChallengeClass {

    STANDARD("standard", 0x0000ffffL, 8_000L, "balanced"),

    HIGH_DIFFICULTY("high_difficulty", 0x000000ffL, 20_000L, "maximum_performance"),

    TIME_PRESSURE("time_pressure", 0x00ffffffL, 6_000L, "speed_focused"),

    EFFICIENCY_TEST("efficiency_test", 0x0000ffffL, 12_000L, "efficiency_focused");

    private final String code;
    private final long baseTarget;
    private final long timeoutMillis;
    private final String optimization;

    ChallengeClass(String code, long baseTarget, long timeoutMillis, String optimization) {
        this.code = code;
        this.baseTarget = baseTarget;
        this.timeoutMillis = timeoutMillis;
        this.optimization = optimization;
    }

    public String getCode() {
        return code;
    }

    public long getBaseTarget() {
        return baseTarget;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public String getOptimization() {
        return optimization;
    }

    /**
     * 相对 STANDARD 的目标缩放比例，用于把矿工的个人难度映射到本类别
     */
    public double relativeScale() {
        return (double) baseTarget / STANDARD.baseTarget;
    }

    /**
     * 按报文编码查找类别
     *
     * @throws IllegalArgumentException 未知编码
     */
    public static ChallengeClass fromCode(String code) {
        for (ChallengeClass value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown challenge class: " + code);
    }
}
