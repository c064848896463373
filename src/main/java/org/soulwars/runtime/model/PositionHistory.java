package org.soulwars.runtime.model;

/**
 * Fixed-size ring buffer of recent positions, used to detect a soul that is not making net progress.
 */
public final class PositionHistory {

    private final double[] xs;
    private final double[] ys;
    private int next;
    private int size;

    public PositionHistory(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Position history needs at least 2 slots: " + capacity);
        }
        this.xs = new double[capacity];
        this.ys = new double[capacity];
    }

    public void record(double x, double y) {
        xs[next] = x;
        ys[next] = y;
        next = (next + 1) % xs.length;
        if (size < xs.length) {
            size++;
        }
    }

    public boolean isFull() {
        return size == xs.length;
    }

    /**
     * @return distance between the oldest and the newest recorded position, 0 with fewer than two entries
     */
    public double netDisplacement() {
        if (size < 2) {
            return 0;
        }
        int newest = (next - 1 + xs.length) % xs.length;
        int oldest = size < xs.length ? 0 : next;
        double dx = xs[newest] - xs[oldest];
        double dy = ys[newest] - ys[oldest];
        return Math.sqrt(dx * dx + dy * dy);
    }

    public void clear() {
        next = 0;
        size = 0;
    }
}
