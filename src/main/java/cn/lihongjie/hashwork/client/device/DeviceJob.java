package cn.lihongjie.hashwork.client.device;

import java.util.Objects;

/**
 * 下发给单个求解单元的任务：在 [nonceStart, nonceEnd) 中搜索满足目标的 nonce
 *
 * @author lihongjie
 */
public class DeviceJob {

    private final String deviceId;
    private final String challengeId;
    private final String payloadHex;
    private final long target;
    private final long nonceStart;
    private final long nonceEnd;

    public DeviceJob(String deviceId, String challengeId, String payloadHex,
                     long target, long nonceStart, long nonceEnd) {
        this.deviceId = Objects.requireNonNull(deviceId, "Device id cannot be null");
        this.challengeId = Objects.requireNonNull(challengeId, "Challenge id cannot be null");
        this.payloadHex = Objects.requireNonNull(payloadHex, "Payload cannot be null");
        if (nonceStart < 0 || nonceEnd < nonceStart) {
            throw new IllegalArgumentException("Invalid nonce range [" + nonceStart + ", " + nonceEnd + ")");
        }
        this.target = target;
        this.nonceStart = nonceStart;
        this.nonceEnd = nonceEnd;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getChallengeId() {
        return challengeId;
    }

    public String getPayloadHex() {
        return payloadHex;
    }

    public long getTarget() {
        return target;
    }

    public long getNonceStart() {
        return nonceStart;
    }

    public long getNonceEnd() {
        return nonceEnd;
    }

    @Override
    public String toString() {
        return "DeviceJob{" +
                "device='" + deviceId + '\'' +
                ", challengeId='" + challengeId + '\'' +
                ", target=0x" + String.format("%08x", target) +
                ", range=[" + nonceStart + ", " + nonceEnd + ")" +
                '}';
    }
}
