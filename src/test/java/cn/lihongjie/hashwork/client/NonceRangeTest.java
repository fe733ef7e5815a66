package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.core.ProofHash;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * nonce 区间切分测试
 *
 * @author lihongjie
 */
public class NonceRangeTest {

    @Test
    public void testSplitCoversRangeWithoutOverlap() {
        for (int parts = 1; parts <= 7; parts++) {
            List<NonceRange> ranges = NonceRange.full().split(parts);
            assertEquals(parts, ranges.size());
            assertEquals(0L, ranges.get(0).getStart());
            assertEquals(ProofHash.NONCE_LIMIT, ranges.get(parts - 1).getEnd());
            long total = 0;
            for (int i = 0; i < ranges.size(); i++) {
                total += ranges.get(i).size();
                if (i > 0) {
                    assertEquals(ranges.get(i - 1).getEnd(), ranges.get(i).getStart());
                }
            }
            assertEquals(ProofHash.NONCE_LIMIT, total);
        }
    }

    @Test
    public void testRemainderGoesToLeadingRanges() {
        List<NonceRange> ranges = new NonceRange(0, 10).split(3);
        assertEquals(new NonceRange(0, 4), ranges.get(0));
        assertEquals(new NonceRange(4, 7), ranges.get(1));
        assertEquals(new NonceRange(7, 10), ranges.get(2));
    }

    @Test
    public void testContains() {
        NonceRange range = new NonceRange(10, 20);
        assertTrue(range.contains(10));
        assertTrue(range.contains(19));
        assertFalse(range.contains(20));
        assertFalse(range.contains(9));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsRangeBeyondNonceSpace() {
        new NonceRange(0, ProofHash.NONCE_LIMIT + 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroParts() {
        NonceRange.full().split(0);
    }
}
