package io.github.jaggr;

public class ArrayUtil {
    public static final int DEFAULT_CAPACITY = 1024;
    // some VMs reserve header words in an array
    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    public static int calculateNewSize(int currentSize) {
        long newSize = (long) currentSize + (currentSize >> 1);
        if (newSize < DEFAULT_CAPACITY) {
            newSize = DEFAULT_CAPACITY;
        }
        if (newSize > MAX_ARRAY_SIZE) {
            if (currentSize >= MAX_ARRAY_SIZE) {
                throw new IllegalStateException(String.format("can not grow array beyond %d", MAX_ARRAY_SIZE));
            }
            newSize = MAX_ARRAY_SIZE;
        }
        return (int) newSize;
    }

    /**
     * @return [0, 1, ..., size - 1]
     */
    public static int[] sequence(int size) {
        int[] ret = new int[size];
        for (int i = 0; i < size; i++) {
            ret[i] = i;
        }
        return ret;
    }
}
