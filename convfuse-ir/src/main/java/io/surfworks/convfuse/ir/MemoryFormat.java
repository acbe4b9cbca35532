package io.surfworks.convfuse.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Physical orderings of 4-D tensor data.
 *
 * <p>{@link #CONTIGUOUS} is row-major over the logical NCHW dimensions;
 * {@link #CHANNELS_LAST} stores the channel dimension innermost (NHWC).
 */
public enum MemoryFormat {
    CONTIGUOUS,
    CHANNELS_LAST;

    /**
     * Computes the strides a tensor of the given sizes has in this format.
     *
     * @param sizes logical sizes (rank 4 for {@link #CHANNELS_LAST})
     * @return element strides, one per dimension
     * @throws IllegalArgumentException if channels-last is requested for a non 4-D shape
     */
    public List<Long> strides(List<Long> sizes) {
        int rank = sizes.size();
        long[] strides = new long[rank];
        if (this == CONTIGUOUS || rank == 0) {
            long stride = 1;
            for (int i = rank - 1; i >= 0; i--) {
                strides[i] = stride;
                stride *= Math.max(sizes.get(i), 1);
            }
        } else {
            if (rank != 4) {
                throw new IllegalArgumentException("channels_last requires rank 4, got " + rank);
            }
            long n = sizes.get(0);
            long c = sizes.get(1);
            long h = sizes.get(2);
            long w = sizes.get(3);
            strides[1] = 1;
            strides[3] = Math.max(c, 1);
            strides[2] = strides[3] * Math.max(w, 1);
            strides[0] = strides[2] * Math.max(h, 1);
            if (n < 0) {
                throw new IllegalArgumentException("Negative batch size: " + n);
            }
        }
        List<Long> result = new ArrayList<>(rank);
        for (long s : strides) {
            result.add(s);
        }
        return result;
    }

    /**
     * Returns true if the given strides lay out a tensor of the given sizes in this format.
     *
     * <p>Dimensions of size one are ignored, their stride never affects addressing.
     */
    public boolean matches(List<Long> sizes, List<Long> strides) {
        if (sizes.size() != strides.size()) {
            return false;
        }
        if (this == CHANNELS_LAST && sizes.size() != 4) {
            return false;
        }
        List<Long> expected = strides(sizes);
        for (int i = 0; i < sizes.size(); i++) {
            if (sizes.get(i) != 1 && !expected.get(i).equals(strides.get(i))) {
                return false;
            }
        }
        return true;
    }
}
