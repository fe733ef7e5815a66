package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.core.ProofHash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * nonce 搜索区间 [start, end)
 *
 * @author lihongjie
 */
public final class NonceRange {

    private final long start;
    private final long end;

    public NonceRange(long start, long end) {
        if (start < 0 || end < start || end > ProofHash.NONCE_LIMIT) {
            throw new IllegalArgumentException("Invalid nonce range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    /**
     * 完整的 32 位 nonce 空间
     */
    public static NonceRange full() {
        return new NonceRange(0L, ProofHash.NONCE_LIMIT);
    }

    /**
     * 切分为 parts 个互不重叠、首尾相接的子区间（余数分给前面的区间）
     */
    public List<NonceRange> split(int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("Parts must be >= 1");
        }
        if (parts == 1) {
            return Collections.singletonList(this);
        }
        long size = size();
        long base = size / parts;
        long remainder = size % parts;
        List<NonceRange> ranges = new ArrayList<>(parts);
        long cursor = start;
        for (int i = 0; i < parts; i++) {
            long length = base + (i < remainder ? 1 : 0);
            ranges.add(new NonceRange(cursor, cursor + length));
            cursor += length;
        }
        return ranges;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long size() {
        return end - start;
    }

    public boolean contains(long nonce) {
        return nonce >= start && nonce < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NonceRange)) {
            return false;
        }
        NonceRange that = (NonceRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 + Long.hashCode(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
