package cn.lihongjie.hashwork.client;

/**
 * 单条求解路径（某个硬件单元或软件求解）的结果
 *
 * @author lihongjie
 */
public class SolveOutcome {

    public enum Kind {
        /**
         * 找到并已本地复验的 nonce
         */
        FOUND,
        /**
         * 硬件故障、过温或报告了无效 Share
         */
        FAULT,
        /**
         * 截止时间已到或被取消
         */
        TIMED_OUT,
        /**
         * 区间搜索完毕仍无解
         */
        EXHAUSTED
    }

    private final Kind kind;
    private final long nonce;
    private final String deviceId;
    private final String reason;

    private SolveOutcome(Kind kind, long nonce, String deviceId, String reason) {
        this.kind = kind;
        this.nonce = nonce;
        this.deviceId = deviceId;
        this.reason = reason;
    }

    public static SolveOutcome found(long nonce, String deviceId) {
        return new SolveOutcome(Kind.FOUND, nonce, deviceId, null);
    }

    public static SolveOutcome fault(String deviceId, String reason) {
        return new SolveOutcome(Kind.FAULT, -1L, deviceId, reason);
    }

    public static SolveOutcome timedOut(String deviceId) {
        return new SolveOutcome(Kind.TIMED_OUT, -1L, deviceId, "deadline reached");
    }

    public static SolveOutcome exhausted(String deviceId) {
        return new SolveOutcome(Kind.EXHAUSTED, -1L, deviceId, "range exhausted");
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public long getNonce() {
        return nonce;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "SolveOutcome{" +
                "kind=" + kind +
                (kind == Kind.FOUND ? ", nonce=" + nonce : "") +
                ", device='" + deviceId + '\'' +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                '}';
    }
}
