package cn.lihongjie.hashwork.client.device;

import cn.lihongjie.hashwork.exception.DeviceLinkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 基于 TCP 行分隔 JSON 的 DeviceLink（每次请求一个连接，与 cgminer API 相同）
 *
 * <p><b>请求 / 应答</b>：
 * <pre>
 * → {"command":"devices"}
 * ← {"status":"ok","devices":["asic-0","asic-1"]}
 * → {"command":"probe","device":"asic-0"}
 * ← {"status":"ok","telemetry":{"temperature":61.5,"hashrate":2.1e9,"error_count":0}}
 * → {"command":"submit","device":"asic-0","challenge_id":"..","payload":"..","target":"0000ffff","nonce_start":0,"nonce_end":2147483648}
 * ← {"status":"ok","job_id":"j-17"}
 * → {"command":"poll","job_id":"j-17"}
 * ← {"status":"ok","state":"found","nonce":12345,"telemetry":{...}}
 * → {"command":"cancel","job_id":"j-17"}
 * ← {"status":"ok"}
 * </pre>
 *
 * <p>连接失败时按固定间隔重试；{@code "status":"error"} 应答不重试。
 *
 * @author lihongjie
 */
public class JsonLineDeviceLink implements DeviceLink {

    private static final Logger log = LoggerFactory.getLogger(JsonLineDeviceLink.class);

    private final String host;
    private final int port;
    private final int timeoutMillis;
    private final int connectionRetries;
    private final long retryDelayMillis;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonLineDeviceLink(String host, int port, int timeoutMillis, int connectionRetries, long retryDelayMillis) {
        this.host = Objects.requireNonNull(host, "Host cannot be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (timeoutMillis <= 0 || connectionRetries < 1 || retryDelayMillis < 0) {
            throw new IllegalArgumentException("Timeout and retries must be positive");
        }
        this.port = port;
        this.timeoutMillis = timeoutMillis;
        this.connectionRetries = connectionRetries;
        this.retryDelayMillis = retryDelayMillis;
    }

    /**
     * 默认：5 秒超时，3 次连接尝试，间隔 1 秒
     */
    public JsonLineDeviceLink(String host, int port) {
        this(host, port, 5_000, 3, 1_000L);
    }

    @Override
    public List<String> devices() {
        JsonNode response = query(command("devices"));
        List<String> ids = new ArrayList<>();
        JsonNode devices = response.path("devices");
        for (JsonNode device : devices) {
            ids.add(device.asText());
        }
        return ids;
    }

    @Override
    public DeviceTelemetry probe(String deviceId) {
        ObjectNode request = command("probe");
        request.put("device", deviceId);
        return telemetry(query(request).path("telemetry"));
    }

    @Override
    public String submit(DeviceJob job) {
        ObjectNode request = command("submit");
        request.put("device", job.getDeviceId());
        request.put("challenge_id", job.getChallengeId());
        request.put("payload", job.getPayloadHex());
        request.put("target", String.format("%08x", job.getTarget()));
        request.put("nonce_start", job.getNonceStart());
        request.put("nonce_end", job.getNonceEnd());
        JsonNode jobId = query(request).get("job_id");
        if (jobId == null || jobId.asText().isEmpty()) {
            throw new DeviceLinkException("Device did not return a job id [device=" + job.getDeviceId() + "]");
        }
        return jobId.asText();
    }

    @Override
    public DevicePoll poll(String jobId) {
        ObjectNode request = command("poll");
        request.put("job_id", jobId);
        JsonNode response = query(request);
        DeviceTelemetry telemetry = telemetry(response.path("telemetry"));
        String state = response.path("state").asText("");
        switch (state) {
            case "pending":
                return DevicePoll.pending(telemetry);
            case "found":
                JsonNode nonce = response.get("nonce");
                if (nonce == null || !nonce.canConvertToLong()) {
                    throw new DeviceLinkException("Found response without nonce [jobId=" + jobId + "]");
                }
                return DevicePoll.found(nonce.asLong(), telemetry);
            case "fault":
                return DevicePoll.fault(response.path("reason").asText("unspecified"), telemetry);
            default:
                throw new DeviceLinkException("Unknown job state '" + state + "' [jobId=" + jobId + "]");
        }
    }

    @Override
    public void cancel(String jobId) {
        ObjectNode request = command("cancel");
        request.put("job_id", jobId);
        query(request);
    }

    private ObjectNode command(String name) {
        ObjectNode request = mapper.createObjectNode();
        request.put("command", name);
        return request;
    }

    private static DeviceTelemetry telemetry(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return DeviceTelemetry.UNKNOWN;
        }
        return new DeviceTelemetry(
                node.path("temperature").asDouble(0.0),
                node.path("hashrate").asDouble(0.0),
                node.path("error_count").asLong(0L));
    }

    /**
     * 带重试的查询：仅连接 / IO 失败重试
     */
    JsonNode query(ObjectNode request) {
        IOException last = null;
        for (int attempt = 1; attempt <= connectionRetries; attempt++) {
            try {
                return checkStatus(request, exchange(request));
            } catch (IOException e) {
                last = e;
                log.warn("Device link query failed [command={}, attempt={}/{}, error={}]",
                        request.path("command").asText(), attempt, connectionRetries, e.getMessage());
                if (attempt < connectionRetries) {
                    sleep(retryDelayMillis);
                }
            }
        }
        throw new DeviceLinkException("Device link unreachable at " + host + ":" + port, last);
    }

    private JsonNode exchange(ObjectNode request) throws IOException {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(request) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new DeviceLinkException("Failed to encode device request", e);
        }

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            OutputStream out = socket.getOutputStream();
            out.write(line);
            out.flush();
            socket.shutdownOutput();

            InputStream in = socket.getInputStream();
            byte[] data = in.readAllBytes();
            if (data.length == 0) {
                throw new IOException("Empty response from device link");
            }
            try {
                return mapper.readTree(new String(data, StandardCharsets.UTF_8).trim());
            } catch (JsonProcessingException e) {
                throw new DeviceLinkException("Invalid JSON response from device link", e);
            }
        }
    }

    private static JsonNode checkStatus(ObjectNode request, JsonNode response) {
        String status = response.path("status").asText("");
        if (!"ok".equals(status)) {
            throw new DeviceLinkException(String.format("Device link error [command=%s, msg=%s]",
                    request.path("command").asText(), response.path("msg").asText("unknown")));
        }
        return response;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeviceLinkException("Interrupted while retrying device link", e);
        }
    }

    @Override
    public String toString() {
        return "JsonLineDeviceLink{" + host + ":" + port + '}';
    }
}
