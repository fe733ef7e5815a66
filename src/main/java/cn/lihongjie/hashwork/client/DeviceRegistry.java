package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.client.device.DeviceLink;
import cn.lihongjie.hashwork.client.device.DeviceTelemetry;
import cn.lihongjie.hashwork.config.MinerConfig;
import cn.lihongjie.hashwork.exception.DeviceLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 求解单元健康状态
 *
 * <p>故障、过温或报告无效 Share 的单元被标记为降级，在 reprobeInterval 内不参与分配；
 * 到期后探测遥测，健康则恢复，否则继续降级。
 *
 * @author lihongjie
 */
public class DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final DeviceLink link;
    private final MinerConfig config;
    private final Map<String, Long> degradedUntil = new ConcurrentHashMap<>();

    public DeviceRegistry(DeviceLink link, MinerConfig config) {
        this.link = Objects.requireNonNull(link, "Device link cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * 先重新探测到期的降级单元，再返回按 ID 排序的健康单元
     */
    public List<String> healthyDevices(long now) {
        List<String> attached;
        try {
            attached = new ArrayList<>(link.devices());
        } catch (DeviceLinkException e) {
            log.warn("Device enumeration failed, treating all units as unavailable: {}", e.getMessage());
            return Collections.emptyList();
        }
        Collections.sort(attached);

        List<String> healthy = new ArrayList<>(attached.size());
        for (String deviceId : attached) {
            Long until = degradedUntil.get(deviceId);
            if (until == null) {
                healthy.add(deviceId);
            } else if (now >= until && reprobe(deviceId, now)) {
                healthy.add(deviceId);
            }
        }
        return healthy;
    }

    private boolean reprobe(String deviceId, long now) {
        try {
            DeviceTelemetry telemetry = link.probe(deviceId);
            if (isOverTemperature(telemetry)) {
                markDegraded(deviceId, now, "still over temperature on re-probe");
                return false;
            }
            degradedUntil.remove(deviceId);
            log.info("Device recovered [device={}, {}]", deviceId, telemetry);
            return true;
        } catch (DeviceLinkException e) {
            markDegraded(deviceId, now, "re-probe failed: " + e.getMessage());
            return false;
        }
    }

    public void markDegraded(String deviceId, long now, String reason) {
        degradedUntil.put(deviceId, now + config.getReprobeIntervalMillis());
        log.warn("Device degraded [device={}, reason={}, reprobeIn={}ms]",
                deviceId, reason, config.getReprobeIntervalMillis());
    }

    public boolean isDegraded(String deviceId) {
        return degradedUntil.containsKey(deviceId);
    }

    public boolean isOverTemperature(DeviceTelemetry telemetry) {
        return telemetry.getTemperature() >= config.getThermalLimit();
    }
}
