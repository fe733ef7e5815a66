package cn.lihongjie.hashwork.model;

import java.util.Objects;

/**
 * 工作量 Challenge 数据模型（签发后不可变）
 *
 * <p>核心字段：
 * <ul>
 *   <li>id: 由 payload + target + 签发时间确定性派生，用于幂等去重</li>
 *   <li>challengeClass: 挑战类别</li>
 *   <li>difficultyTarget: 32 位压缩目标，合法哈希必须 ≤ 展开后的目标</li>
 *   <li>timeoutMillis: 求解时限</li>
 *   <li>issuedAt: 签发时间（毫秒时间戳）</li>
 *   <li>payloadHex: 一次性随机种子（十六进制）</li>
 * </ul>
 *
 * @author lihongjie
 */
public class Challenge {

    /**
     * payload 固定 32 字节（64 个十六进制字符）
     */
    public static final int PAYLOAD_BYTES = 32;

    public static final long MAX_TARGET = 0xffffffffL;

    private final String id;
    private final ChallengeClass challengeClass;
    private final long difficultyTarget;
    private final long timeoutMillis;
    private final long issuedAt;
    private final String payloadHex;

    private Challenge(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Challenge id cannot be null");
        this.challengeClass = Objects.requireNonNull(builder.challengeClass, "Challenge class cannot be null");
        this.payloadHex = Objects.requireNonNull(builder.payloadHex, "Payload cannot be null");
        if (builder.difficultyTarget <= 0 || builder.difficultyTarget > MAX_TARGET) {
            throw new IllegalArgumentException(String.format(
                    "Difficulty target must be in (0, 0x%08x]: 0x%x", MAX_TARGET, builder.difficultyTarget));
        }
        requirePayloadHex(payloadHex);
        if (builder.timeoutMillis <= 0) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.difficultyTarget = builder.difficultyTarget;
        this.timeoutMillis = builder.timeoutMillis;
        this.issuedAt = builder.issuedAt;
    }

    private static void requirePayloadHex(String hex) {
        if (hex.length() != PAYLOAD_BYTES * 2) {
            throw new IllegalArgumentException(String.format(
                    "Payload must be %d hex characters, got %d", PAYLOAD_BYTES * 2, hex.length()));
        }
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F'))) {
                throw new IllegalArgumentException("Invalid hex character in payload at " + i);
            }
        }
    }

    public String getId() {
        return id;
    }

    public ChallengeClass getChallengeClass() {
        return challengeClass;
    }

    public long getDifficultyTarget() {
        return difficultyTarget;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public long getIssuedAt() {
        return issuedAt;
    }

    public String getPayloadHex() {
        return payloadHex;
    }

    /**
     * 最迟可接受提交时间：issuedAt + timeout + grace
     */
    public long acceptDeadline(long graceMillis) {
        return issuedAt + timeoutMillis + graceMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ChallengeClass challengeClass;
        private long difficultyTarget;
        private long timeoutMillis;
        private long issuedAt;
        private String payloadHex;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder challengeClass(ChallengeClass challengeClass) {
            this.challengeClass = challengeClass;
            return this;
        }

        public Builder difficultyTarget(long difficultyTarget) {
            this.difficultyTarget = difficultyTarget;
            return this;
        }

        public Builder timeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder issuedAt(long issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder payloadHex(String payloadHex) {
            this.payloadHex = payloadHex;
            return this;
        }

        public Challenge build() {
            return new Challenge(this);
        }
    }

    @Override
    public String toString() {
        return "Challenge{" +
                "id='" + id + '\'' +
                ", class=" + challengeClass.getCode() +
                ", target=0x" + String.format("%08x", difficultyTarget) +
                ", timeout=" + timeoutMillis + "ms" +
                ", issuedAt=" + issuedAt +
                '}';
    }
}
