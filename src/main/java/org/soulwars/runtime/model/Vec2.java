package org.soulwars.runtime.model;

/**
 * Immutable 2D vector in world units.
 */
public record Vec2(double x, double y) {

    public static final Vec2 ZERO = new Vec2(0, 0);

    public Vec2 plus(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 minus(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    public Vec2 times(double factor) {
        return new Vec2(x * factor, y * factor);
    }

    public double length() {
        return Math.sqrt(x * x + y * y);
    }

    public double distanceTo(Vec2 other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public double distanceTo(double ox, double oy) {
        double dx = ox - x;
        double dy = oy - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * @return this vector scaled to unit length, or {@link #ZERO} for a zero vector
     */
    public Vec2 normalized() {
        double len = length();
        return len == 0 ? ZERO : new Vec2(x / len, y / len);
    }

    /**
     * @param maxLength the length limit
     * @return this vector, shortened to {@code maxLength} if it is longer
     */
    public Vec2 clampLength(double maxLength) {
        double len = length();
        return len > maxLength && len > 0 ? times(maxLength / len) : this;
    }

    /**
     * @param midpointOf the other end
     * @return the point halfway between this and {@code midpointOf}
     */
    public Vec2 midpoint(Vec2 midpointOf) {
        return new Vec2((x + midpointOf.x) / 2.0, (y + midpointOf.y) / 2.0);
    }
}
