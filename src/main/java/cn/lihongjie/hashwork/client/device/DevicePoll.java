package cn.lihongjie.hashwork.client.device;

/**
 * 一次任务轮询的应答
 *
 * @author lihongjie
 */
public class DevicePoll {

    public enum Status {
        PENDING,
        FOUND,
        FAULT
    }

    private final Status status;
    private final long nonce;
    private final String reason;
    private final DeviceTelemetry telemetry;

    private DevicePoll(Status status, long nonce, String reason, DeviceTelemetry telemetry) {
        this.status = status;
        this.nonce = nonce;
        this.reason = reason;
        this.telemetry = telemetry == null ? DeviceTelemetry.UNKNOWN : telemetry;
    }

    public static DevicePoll pending(DeviceTelemetry telemetry) {
        return new DevicePoll(Status.PENDING, -1L, null, telemetry);
    }

    public static DevicePoll found(long nonce, DeviceTelemetry telemetry) {
        return new DevicePoll(Status.FOUND, nonce, null, telemetry);
    }

    public static DevicePoll fault(String reason, DeviceTelemetry telemetry) {
        return new DevicePoll(Status.FAULT, -1L, reason, telemetry);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return 仅 FOUND 时有效
     */
    public long getNonce() {
        return nonce;
    }

    public String getReason() {
        return reason;
    }

    public DeviceTelemetry getTelemetry() {
        return telemetry;
    }

    @Override
    public String toString() {
        return "DevicePoll{" +
                "status=" + status +
                (status == Status.FOUND ? ", nonce=" + nonce : "") +
                (reason != null ? ", reason='" + reason + '\'' : "") +
                ", " + telemetry +
                '}';
    }
}
