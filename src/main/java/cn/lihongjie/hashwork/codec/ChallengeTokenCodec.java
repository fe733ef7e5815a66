package cn.lihongjie.hashwork.codec;

import cn.lihongjie.hashwork.exception.ProtocolException;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Challenge 消息编解码（HS256 签名 JWT）
 *
 * <p><b>Claims</b>：
 * <pre>
 * cid  Challenge ID（同时写入 jti）
 * cls  类别代码
 * tgt  压缩难度目标（8 位十六进制）
 * tmo  时限（毫秒）
 * pld  payload（十六进制）
 * ims  签发时间（毫秒时间戳）
 * </pre>
 *
 * <p>可附带业务上下文 claims（保留字段会被过滤）。矿工侧若持有密钥则校验签名，
 * 否则只做无签名解析。
 *
 * @author lihongjie
 */
public class ChallengeTokenCodec {

    private static final Logger log = LoggerFactory.getLogger(ChallengeTokenCodec.class);

    public static final String CLAIM_ID = "cid";
    public static final String CLAIM_CLASS = "cls";
    public static final String CLAIM_TARGET = "tgt";
    public static final String CLAIM_TIMEOUT = "tmo";
    public static final String CLAIM_PAYLOAD = "pld";
    public static final String CLAIM_ISSUED_AT = "ims";

    /**
     * 上下文字段：Challenge 签发对象的矿工 ID
     */
    public static final String CONTEXT_MINER = "mid";

    private static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            CLAIM_ID, CLAIM_CLASS, CLAIM_TARGET, CLAIM_TIMEOUT, CLAIM_PAYLOAD, CLAIM_ISSUED_AT,
            "iat", "exp", "jti", "iss", "sub", "aud", "nbf")));

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SecretKey secretKey;

    /**
     * @param secret 签名密钥（≥256 bit）
     */
    public ChallengeTokenCodec(String secret) {
        Objects.requireNonNull(secret, "Secret key cannot be null");
        if (secret.length() < 32) {
            throw new IllegalArgumentException(
                    "Secret key must be at least 256 bits (32 characters)");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String encode(Challenge challenge) {
        return encode(challenge, null);
    }

    /**
     * 签发 Challenge 消息
     *
     * @param context 附加上下文（可选），保留字段被忽略
     */
    public String encode(Challenge challenge, Map<String, Object> context) {
        Objects.requireNonNull(challenge, "Challenge cannot be null");
        JwtBuilder builder = Jwts.builder()
                .claim("jti", challenge.getId())
                .claim("iat", challenge.getIssuedAt() / 1000)
                .claim(CLAIM_ID, challenge.getId())
                .claim(CLAIM_CLASS, challenge.getChallengeClass().getCode())
                .claim(CLAIM_TARGET, String.format("%08x", challenge.getDifficultyTarget()))
                .claim(CLAIM_TIMEOUT, challenge.getTimeoutMillis())
                .claim(CLAIM_PAYLOAD, challenge.getPayloadHex())
                .claim(CLAIM_ISSUED_AT, challenge.getIssuedAt());

        if (context != null && !context.isEmpty()) {
            context.entrySet().stream()
                    .filter(entry -> !isReservedField(entry.getKey()))
                    .forEach(entry -> builder.claim(entry.getKey(), entry.getValue()));
        }

        String token = builder.signWith(secretKey, SignatureAlgorithm.HS256).compact();
        log.debug("Encoded challenge token [id={}, context={}]", challenge.getId(),
                context != null ? context.keySet() : "none");
        return token;
    }

    public Challenge decode(String token) {
        return decode(token, null);
    }

    /**
     * 校验签名并解析，可选校验上下文一致性
     *
     * @throws ProtocolException 签名错误、字段缺失或上下文不一致
     */
    public Challenge decode(String token, Map<String, Object> expectedContext) {
        Objects.requireNonNull(token, "Token cannot be null");
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(secretKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (SignatureException e) {
            log.error("Challenge signature verification failed: {}", e.getMessage());
            throw new ProtocolException("Invalid challenge signature", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Malformed challenge token: {}", e.getMessage());
            throw new ProtocolException("Malformed challenge token: " + e.getMessage(), e);
        }

        if (expectedContext != null && !expectedContext.isEmpty()) {
            validateContext(claims, expectedContext);
        }

        try {
            return Challenge.builder()
                    .id(require(claims.get(CLAIM_ID, String.class), CLAIM_ID))
                    .challengeClass(ChallengeClass.fromCode(require(claims.get(CLAIM_CLASS, String.class), CLAIM_CLASS)))
                    .difficultyTarget(parseTarget(require(claims.get(CLAIM_TARGET, String.class), CLAIM_TARGET)))
                    .timeoutMillis(number(claims.get(CLAIM_TIMEOUT), CLAIM_TIMEOUT))
                    .issuedAt(number(claims.get(CLAIM_ISSUED_AT), CLAIM_ISSUED_AT))
                    .payloadHex(require(claims.get(CLAIM_PAYLOAD, String.class), CLAIM_PAYLOAD))
                    .build();
        } catch (IllegalArgumentException | NullPointerException | JwtException e) {
            throw new ProtocolException("Invalid challenge claims: " + e.getMessage(), e);
        }
    }

    /**
     * 不校验签名直接解析 Payload（矿工未持有验证方密钥时使用）
     */
    public static Challenge decodeUnverified(String token) {
        Objects.requireNonNull(token, "Token cannot be null");
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new ProtocolException("Invalid JWT format");
        }
        try {
            JsonNode body = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            return Challenge.builder()
                    .id(text(body, CLAIM_ID))
                    .challengeClass(ChallengeClass.fromCode(text(body, CLAIM_CLASS)))
                    .difficultyTarget(parseTarget(text(body, CLAIM_TARGET)))
                    .timeoutMillis(longValue(body, CLAIM_TIMEOUT))
                    .issuedAt(longValue(body, CLAIM_ISSUED_AT))
                    .payloadHex(text(body, CLAIM_PAYLOAD))
                    .build();
        } catch (IOException e) {
            throw new ProtocolException("Unreadable challenge payload", e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ProtocolException("Invalid challenge payload: " + e.getMessage(), e);
        }
    }

    private void validateContext(Claims claims, Map<String, Object> expectedContext) {
        for (Map.Entry<String, Object> entry : expectedContext.entrySet()) {
            String key = entry.getKey();
            if (isReservedField(key)) {
                continue;
            }
            Object actual = claims.get(key);
            if (actual == null) {
                log.error("Context validation failed: missing field '{}'", key);
                throw new ProtocolException(String.format(
                        "Context validation failed: missing field '%s'", key));
            }
            if (!entry.getValue().equals(actual)) {
                log.error("Context validation failed: field '{}' mismatch (expected={}, actual={})",
                        key, entry.getValue(), actual);
                throw new ProtocolException(String.format(
                        "Context validation failed: field '%s' mismatch (expected=%s, actual=%s)",
                        key, entry.getValue(), actual));
            }
        }
    }

    static boolean isReservedField(String fieldName) {
        return RESERVED.contains(fieldName);
    }

    private static long parseTarget(String hex) {
        return Long.parseLong(hex, 16);
    }

    private static <T> T require(T value, String claim) {
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + claim + "' in challenge");
        }
        return value;
    }

    private static long number(Object value, String claim) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Missing '" + claim + "' in challenge");
        }
        return ((Number) value).longValue();
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isTextual()) {
            throw new IllegalArgumentException("Missing '" + field + "' in challenge");
        }
        return node.asText();
    }

    private static long longValue(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.canConvertToLong()) {
            throw new IllegalArgumentException("Missing '" + field + "' in challenge");
        }
        return node.asLong();
    }
}
