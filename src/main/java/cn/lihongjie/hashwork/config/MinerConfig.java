package cn.lihongjie.hashwork.config;

import cn.lihongjie.hashwork.exception.HashWorkException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 矿工侧配置（不可变）
 *
 * @author lihongjie
 */
public final class MinerConfig {

    public static final String DEFAULT_RESOURCE = "hashwork-miner.properties";

    /**
     * 截止时间前预留的网络传输余量
     */
    private final long safetyMarginMillis;

    /**
     * 设备轮询间隔
     */
    private final long pollIntervalMillis;

    /**
     * 降级设备的重新探测间隔
     */
    private final long reprobeIntervalMillis;

    /**
     * 软件求解线程数
     */
    private final int softwareThreads;

    /**
     * 设备温度上限（℃），达到即视为故障
     */
    private final double thermalLimit;

    /**
     * 软件求解每隔多少次哈希检查一次截止时间与取消标志
     */
    private final int hashCheckInterval;

    private MinerConfig(Builder b) {
        this.safetyMarginMillis = b.safetyMarginMillis;
        this.pollIntervalMillis = b.pollIntervalMillis;
        this.reprobeIntervalMillis = b.reprobeIntervalMillis;
        this.softwareThreads = b.softwareThreads;
        this.thermalLimit = b.thermalLimit;
        this.hashCheckInterval = b.hashCheckInterval;
    }

    public static MinerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MinerConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = MinerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new HashWorkException("Failed to read miner config: " + resource, e);
        }
        return fromProperties(properties);
    }

    public static MinerConfig fromProperties(Properties p) {
        Builder b = builder();
        if (p.getProperty("miner.safety-margin-ms") != null) {
            b.safetyMarginMillis(Long.parseLong(p.getProperty("miner.safety-margin-ms").trim()));
        }
        if (p.getProperty("miner.poll-interval-ms") != null) {
            b.pollIntervalMillis(Long.parseLong(p.getProperty("miner.poll-interval-ms").trim()));
        }
        if (p.getProperty("miner.reprobe-interval-ms") != null) {
            b.reprobeIntervalMillis(Long.parseLong(p.getProperty("miner.reprobe-interval-ms").trim()));
        }
        if (p.getProperty("miner.software-threads") != null) {
            b.softwareThreads(Integer.parseInt(p.getProperty("miner.software-threads").trim()));
        }
        if (p.getProperty("miner.thermal-limit") != null) {
            b.thermalLimit(Double.parseDouble(p.getProperty("miner.thermal-limit").trim()));
        }
        if (p.getProperty("miner.hash-check-interval") != null) {
            b.hashCheckInterval(Integer.parseInt(p.getProperty("miner.hash-check-interval").trim()));
        }
        return b.build();
    }

    public long getSafetyMarginMillis() {
        return safetyMarginMillis;
    }

    public long getPollIntervalMillis() {
        return pollIntervalMillis;
    }

    public long getReprobeIntervalMillis() {
        return reprobeIntervalMillis;
    }

    public int getSoftwareThreads() {
        return softwareThreads;
    }

    public double getThermalLimit() {
        return thermalLimit;
    }

    public int getHashCheckInterval() {
        return hashCheckInterval;
    }

    public static class Builder {
        private long safetyMarginMillis = 500L;
        private long pollIntervalMillis = 50L;
        private long reprobeIntervalMillis = 30_000L;
        private int softwareThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private double thermalLimit = 78.0;
        private int hashCheckInterval = 1024;

        private Builder() {
        }

        public Builder safetyMarginMillis(long safetyMarginMillis) {
            this.safetyMarginMillis = safetyMarginMillis;
            return this;
        }

        public Builder pollIntervalMillis(long pollIntervalMillis) {
            this.pollIntervalMillis = pollIntervalMillis;
            return this;
        }

        public Builder reprobeIntervalMillis(long reprobeIntervalMillis) {
            this.reprobeIntervalMillis = reprobeIntervalMillis;
            return this;
        }

        public Builder softwareThreads(int softwareThreads) {
            this.softwareThreads = softwareThreads;
            return this;
        }

        public Builder thermalLimit(double thermalLimit) {
            this.thermalLimit = thermalLimit;
            return this;
        }

        public Builder hashCheckInterval(int hashCheckInterval) {
            this.hashCheckInterval = hashCheckInterval;
            return this;
        }

        public MinerConfig build() {
            if (safetyMarginMillis < 0) {
                throw new IllegalArgumentException("Safety margin must be >= 0");
            }
            if (pollIntervalMillis <= 0 || reprobeIntervalMillis <= 0) {
                throw new IllegalArgumentException("Poll and re-probe intervals must be positive");
            }
            if (softwareThreads < 1) {
                throw new IllegalArgumentException("At least one software thread is required");
            }
            if (hashCheckInterval < 1) {
                throw new IllegalArgumentException("Hash check interval must be positive");
            }
            return new MinerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "MinerConfig{" +
                "safetyMargin=" + safetyMarginMillis + "ms" +
                ", pollInterval=" + pollIntervalMillis + "ms" +
                ", reprobeInterval=" + reprobeIntervalMillis + "ms" +
                ", softwareThreads=" + softwareThreads +
                ", thermalLimit=" + thermalLimit +
                '}';
    }
}
