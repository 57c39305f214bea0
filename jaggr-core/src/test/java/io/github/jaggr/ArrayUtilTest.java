package io.github.jaggr;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ArrayUtilTest {
    @Test
    public void calculateNewSize() {
        assertEquals(ArrayUtil.DEFAULT_CAPACITY, ArrayUtil.calculateNewSize(1));
        assertEquals(3000, ArrayUtil.calculateNewSize(2000));
        assertEquals(Integer.MAX_VALUE - 8, ArrayUtil.calculateNewSize(Integer.MAX_VALUE - 100));
    }

    @Test(expected = IllegalStateException.class)
    public void cannotGrowPastMaxArraySize() {
        ArrayUtil.calculateNewSize(Integer.MAX_VALUE - 8);
    }

    @Test
    public void sequence() {
        assertArrayEquals(new int[]{0, 1, 2, 3}, ArrayUtil.sequence(4));
        assert ArrayUtil.sequence(0).length == 0;
    }
}
