package cn.lihongjie.hashwork.codec;

import cn.lihongjie.hashwork.exception.ProtocolException;
import cn.lihongjie.hashwork.model.Proof;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Proof 消息编解码（JSON）
 *
 * <pre>
 * {"challenge_id": "...", "nonce": 123, "elapsed_ms": 2500, "device_id": "asic-0"}
 * </pre>
 *
 * <p>submitted_at 不在报文中，由验证方按接收时间填写。
 *
 * @author lihongjie
 */
public class ProofMessageCodec {

    private final ObjectMapper mapper;

    public ProofMessageCodec() {
        this(new ObjectMapper());
    }

    public ProofMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
    }

    public String encode(Proof proof) {
        ObjectNode node = mapper.createObjectNode();
        node.put("challenge_id", proof.getChallengeId());
        node.put("nonce", proof.getNonce());
        node.put("elapsed_ms", proof.getElapsedMs());
        node.put("device_id", proof.getDeviceId());
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode proof", e);
        }
    }

    /**
     * @param receivedAt 验证方接收时间
     * @throws ProtocolException 非 JSON、字段缺失或 nonce 不是无符号 32 位整数
     */
    public Proof decode(String message, long receivedAt) {
        if (message == null || message.isBlank()) {
            throw new ProtocolException("Empty proof message");
        }
        JsonNode node;
        try {
            node = mapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Proof message is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Proof message must be a JSON object");
        }

        String challengeId = requireText(node, "challenge_id");
        long nonce = requireLong(node, "nonce");
        if (nonce < 0 || nonce > 0xffffffffL) {
            throw new ProtocolException("Nonce out of 32-bit range: " + nonce);
        }
        long elapsed = node.has("elapsed_ms") ? requireLong(node, "elapsed_ms") : -1L;
        String deviceId = node.hasNonNull("device_id") ? node.get("device_id").asText() : "unknown";
        return new Proof(challengeId, nonce, elapsed, deviceId, receivedAt);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new ProtocolException("Missing '" + field + "' in proof message");
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ProtocolException("Missing or non-integer '" + field + "' in proof message");
        }
        return value.asLong();
    }
}
