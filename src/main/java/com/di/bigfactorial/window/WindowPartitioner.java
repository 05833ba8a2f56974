package com.di.bigfactorial.window;

/**
 * Slices {@code [1, n]} into consecutive {@link Window}s of a fixed size;
 * the last window is truncated to {@code n}.
 *
 * <p>The reducer asks for windows one at a time through {@link #next(long, long)}
 * so the full list never needs to be materialised for large {@code n}.
 */
public class WindowPartitioner {

    private final long windowSize;

    public WindowPartitioner(long windowSize) {
        if (windowSize <= 0) throw new IllegalArgumentException("windowSize must be > 0");
        this.windowSize = windowSize;
    }

    public long getWindowSize() {
        return windowSize;
    }

    /**
     * Returns the window starting at {@code start}, ending at
     * {@code min(n, start + windowSize - 1)}.
     *
     * @throws IllegalArgumentException if {@code start} is outside {@code [1, n]}
     */
    public Window next(long start, long n) {
        if (start < 1 || start > n) {
            throw new IllegalArgumentException(
                    String.format("window start %d outside [1, %d]", start, n));
        }
        // n - start < windowSize, written so start + windowSize cannot overflow
        long end = (n - start < windowSize) ? n : start + windowSize - 1;
        return Window.builder().start(start).end(end).build();
    }

    /** Ceiling division: number of windows covering {@code [1, n]}; 0 when {@code n < 1}. */
    public long count(long n) {
        if (n < 1) return 0;
        return (n - 1) / windowSize + 1;
    }
}
