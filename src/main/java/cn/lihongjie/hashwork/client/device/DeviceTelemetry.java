package cn.lihongjie.hashwork.client.device;

/**
 * 求解单元遥测：温度、算力、累计硬件错误
 *
 * @author lihongjie
 */
public class DeviceTelemetry {

    public static final DeviceTelemetry UNKNOWN = new DeviceTelemetry(0.0, 0.0, 0L);

    private final double temperature;
    private final double hashrate;
    private final long errorCount;

    public DeviceTelemetry(double temperature, double hashrate, long errorCount) {
        this.temperature = temperature;
        this.hashrate = hashrate;
        this.errorCount = errorCount;
    }

    /**
     * 摄氏度
     */
    public double getTemperature() {
        return temperature;
    }

    /**
     * 哈希 / 秒
     */
    public double getHashrate() {
        return hashrate;
    }

    public long getErrorCount() {
        return errorCount;
    }

    @Override
    public String toString() {
        return String.format("Telemetry{temp=%.1fC, hashrate=%.0fH/s, errors=%d}", temperature, hashrate, errorCount);
    }
}
