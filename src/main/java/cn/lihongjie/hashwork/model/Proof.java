package cn.lihongjie.hashwork.model;

/**
 * 矿工对某个 Challenge 提交的解答（Share）
 *
 * @author lihongjie
 */
public class Proof {

    /**
     * 对应的 Challenge ID
     */
    private final String challengeId;

    /**
     * 找到的 Nonce（无符号 32 位）
     */
    private final long nonce;

    /**
     * 矿工侧报告的求解耗时（毫秒）
     */
    private final long elapsedMs;

    /**
     * 求解设备标识，软件求解为 {@code "software"}
     */
    private final String deviceId;

    /**
     * 验证方收到提交的时间（毫秒时间戳）
     */
    private final long submittedAt;

    public Proof(String challengeId, long nonce, long elapsedMs, String deviceId, long submittedAt) {
        this.challengeId = challengeId;
        this.nonce = nonce;
        this.elapsedMs = elapsedMs;
        this.deviceId = deviceId;
        this.submittedAt = submittedAt;
    }

    public String getChallengeId() {
        return challengeId;
    }

    public long getNonce() {
        return nonce;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public long getSubmittedAt() {
        return submittedAt;
    }

    /**
     * 以新的接收时间复制（验证方以自己的时钟为准）
     */
    public Proof receivedAt(long submittedAt) {
        return new Proof(challengeId, nonce, elapsedMs, deviceId, submittedAt);
    }

    @Override
    public String toString() {
        return "Proof{" +
                "challengeId='" + challengeId + '\'' +
                ", nonce=" + nonce +
                ", elapsed=" + elapsedMs + "ms" +
                ", deviceId='" + deviceId + '\'' +
                ", submittedAt=" + submittedAt +
                '}';
    }
}
