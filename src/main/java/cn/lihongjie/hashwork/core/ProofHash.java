package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.exception.HashWorkException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 工作量哈希与目标比较（验证方与矿工共用）
 *
 * <p><b>核心算法</b>：
 * <pre>
 * hash   = SHA-256(payload || nonce_le32)
 * target = compact(4 字节, 大端) || 0xff × 28
 * 合法条件：hash ≤ target（大端无符号比较）
 * </pre>
 *
 * <p>实现策略：字节数组比对，避免 BigInteger 运算。
 *
 * @author lihongjie
 */
public final class ProofHash {

    /**
     * nonce 空间上界（不含）：2^32
     */
    public static final long NONCE_LIMIT = 1L << 32;

    public static final int HASH_BYTES = 32;

    private ProofHash() {
    }

    /**
     * 新建 SHA-256 实例（MessageDigest 非线程安全，每个线程自持一个）
     */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new HashWorkException("SHA-256 not available", e);
        }
    }

    public static byte[] hash(byte[] payload, long nonce) {
        return hash(newDigest(), payload, nonce);
    }

    /**
     * 复用调用方的 MessageDigest 计算哈希
     */
    public static byte[] hash(MessageDigest digest, byte[] payload, long nonce) {
        if (nonce < 0 || nonce >= NONCE_LIMIT) {
            throw new IllegalArgumentException("Nonce out of range: " + nonce);
        }
        digest.reset();
        digest.update(payload);
        digest.update((byte) nonce);
        digest.update((byte) (nonce >>> 8));
        digest.update((byte) (nonce >>> 16));
        digest.update((byte) (nonce >>> 24));
        return digest.digest();
    }

    /**
     * 把 32 位压缩目标展开为 32 字节阈值
     */
    public static byte[] expandTarget(long compactTarget) {
        if (compactTarget <= 0 || compactTarget > 0xffffffffL) {
            throw new IllegalArgumentException("Compact target out of range: " + compactTarget);
        }
        byte[] target = new byte[HASH_BYTES];
        target[0] = (byte) (compactTarget >>> 24);
        target[1] = (byte) (compactTarget >>> 16);
        target[2] = (byte) (compactTarget >>> 8);
        target[3] = (byte) compactTarget;
        for (int i = 4; i < HASH_BYTES; i++) {
            target[i] = (byte) 0xff;
        }
        return target;
    }

    public static boolean meetsTarget(byte[] hash, byte[] expandedTarget) {
        return compareUnsignedByteArrays(hash, expandedTarget) <= 0;
    }

    /**
     * 重新计算并判定 hash(payload, nonce) ≤ target
     */
    public static boolean verify(byte[] payload, long nonce, long compactTarget) {
        if (nonce < 0 || nonce >= NONCE_LIMIT) {
            return false;
        }
        return meetsTarget(hash(payload, nonce), expandTarget(compactTarget));
    }

    /**
     * 无符号字节数组比对（大端序）
     *
     * @return -1 if a < b, 0 if a == b, 1 if a > b
     */
    static int compareUnsignedByteArrays(byte[] a, byte[] b) {
        int minLength = Math.min(a.length, b.length);

        for (int i = 0; i < minLength; i++) {
            int unsignedA = a[i] & 0xFF;
            int unsignedB = b[i] & 0xFF;

            if (unsignedA < unsignedB) {
                return -1;
            } else if (unsignedA > unsignedB) {
                return 1;
            }
        }

        return Integer.compare(a.length, b.length);
    }

    public static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException 长度为奇数或含非十六进制字符
     */
    public static byte[] hexToBytes(String hex) {
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have even length");
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(hex.charAt(i), 16);
            int lo = Character.digit(hex.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex character at " + i);
            }
            data[i / 2] = (byte) ((hi << 4) + lo);
        }
        return data;
    }
}
