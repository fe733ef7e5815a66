package cn.lihongjie.hashwork.client.device;

import cn.lihongjie.hashwork.core.ProofHash;
import cn.lihongjie.hashwork.exception.DeviceLinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内模拟求解单元
 *
 * <p>每个任务在后台线程上真实计算 SHA-256 搜索 nonce，可注入故障：
 * <ul>
 *   <li>{@link #injectFault(String)}：后续轮询返回 FAULT</li>
 *   <li>{@link #setTemperature(String, double)}：遥测温度</li>
 *   <li>{@link #reportBogusShares(String)}：报告不满足目标的 nonce</li>
 * </ul>
 *
 * @author lihongjie
 */
public class SimulatedDeviceLink implements DeviceLink {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDeviceLink.class);

    private final Map<String, Unit> units = new ConcurrentHashMap<>();
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final AtomicLong jobSequence = new AtomicLong();

    public SimulatedDeviceLink(int unitCount) {
        if (unitCount < 0) {
            throw new IllegalArgumentException("Unit count must be >= 0");
        }
        for (int i = 0; i < unitCount; i++) {
            String id = "sim-" + i;
            units.put(id, new Unit(id));
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sim-device-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public List<String> devices() {
        List<String> ids = new ArrayList<>(units.keySet());
        ids.sort(null);
        return ids;
    }

    @Override
    public DeviceTelemetry probe(String deviceId) {
        return unit(deviceId).telemetry();
    }

    @Override
    public String submit(DeviceJob job) {
        Unit unit = unit(job.getDeviceId());
        if (unit.faulted) {
            throw new DeviceLinkException("Device not responding [device=" + unit.id + "]");
        }
        String jobId = "job-" + jobSequence.incrementAndGet();
        Job running = new Job(unit, job);
        jobs.put(jobId, running);
        executor.execute(running::search);
        log.debug("Simulated job started [jobId={}, job={}]", jobId, job);
        return jobId;
    }

    @Override
    public DevicePoll poll(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new DeviceLinkException("Unknown job [jobId=" + jobId + "]");
        }
        Unit unit = job.unit;
        DeviceTelemetry telemetry = unit.telemetry();
        if (unit.faulted) {
            job.cancelled = true;
            return DevicePoll.fault("bus error", telemetry);
        }
        if (unit.bogusShares) {
            return DevicePoll.found(job.request.getNonceStart(), telemetry);
        }
        long found = job.found;
        return found >= 0 ? DevicePoll.found(found, telemetry) : DevicePoll.pending(telemetry);
    }

    @Override
    public void cancel(String jobId) {
        Job job = jobs.remove(jobId);
        if (job != null) {
            job.cancelled = true;
        }
    }

    public void injectFault(String deviceId) {
        unit(deviceId).faulted = true;
        log.info("Injected fault [device={}]", deviceId);
    }

    public void clearFault(String deviceId) {
        unit(deviceId).faulted = false;
    }

    public void setTemperature(String deviceId, double temperature) {
        unit(deviceId).temperature = temperature;
    }

    public void reportBogusShares(String deviceId) {
        unit(deviceId).bogusShares = true;
    }

    private Unit unit(String deviceId) {
        Unit unit = units.get(deviceId);
        if (unit == null) {
            throw new DeviceLinkException("Unknown device [device=" + deviceId + "]");
        }
        return unit;
    }

    @Override
    public void close() {
        for (Job job : jobs.values()) {
            job.cancelled = true;
        }
        jobs.clear();
        executor.shutdownNow();
    }

    private static final class Unit {
        private final String id;
        private volatile boolean faulted;
        private volatile boolean bogusShares;
        private volatile double temperature = 55.0;
        private volatile double hashrate;
        private final AtomicLong errors = new AtomicLong();

        private Unit(String id) {
            this.id = id;
        }

        private DeviceTelemetry telemetry() {
            if (faulted) {
                errors.incrementAndGet();
            }
            return new DeviceTelemetry(temperature, hashrate, errors.get());
        }
    }

    private static final class Job {
        private final Unit unit;
        private final DeviceJob request;
        private volatile boolean cancelled;
        private volatile long found = -1L;

        private Job(Unit unit, DeviceJob request) {
            this.unit = unit;
            this.request = request;
        }

        private void search() {
            byte[] payload = ProofHash.hexToBytes(request.getPayloadHex());
            byte[] target = ProofHash.expandTarget(request.getTarget());
            MessageDigest digest = ProofHash.newDigest();
            long started = System.nanoTime();
            long end = Math.min(request.getNonceEnd(), ProofHash.NONCE_LIMIT);
            for (long nonce = request.getNonceStart(); nonce < end && !cancelled; nonce++) {
                if (ProofHash.meetsTarget(ProofHash.hash(digest, payload, nonce), target)) {
                    long hashes = nonce - request.getNonceStart() + 1;
                    double seconds = Math.max(1L, System.nanoTime() - started) / 1e9;
                    unit.hashrate = hashes / seconds;
                    found = nonce;
                    return;
                }
            }
        }
    }
}
