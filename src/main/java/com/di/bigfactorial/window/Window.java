package com.di.bigfactorial.window;

import lombok.Builder;
import lombok.Value;

/**
 * A contiguous run of integers multiplied as one unit of work.
 *
 * <p>The range is <em>inclusive</em> on both ends: {@code start * (start+1) * ... * end}.
 * A window is identified by its {@code start}; no two windows of one
 * reduction share a start offset.
 */
@Value
@Builder
public class Window {

    /** Inclusive lower bound, also the window's identity within a reduction. */
    long start;

    /** Inclusive upper bound, {@code >= start}. */
    long end;

    /** Number of integers in the window. */
    public long size() {
        return end - start + 1;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + "]";
    }
}
