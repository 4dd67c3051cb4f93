package io.hearthwarrio.elementscout.core.dom;

import java.util.Objects;

/**
 * Viewport-relative bounding box, as returned by {@code getBoundingClientRect()}.
 */
public final class BoundingRect {

    public static final BoundingRect EMPTY = new BoundingRect(0, 0, 0, 0);

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BoundingRect(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    /**
     * @return {@code true} when either dimension is zero
     */
    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    @Override
    public String toString() {
        return "BoundingRect{" +
                "x=" + x +
                ", y=" + y +
                ", width=" + width +
                ", height=" + height +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingRect)) return false;
        BoundingRect that = (BoundingRect) o;
        return Double.compare(x, that.x) == 0 &&
                Double.compare(y, that.y) == 0 &&
                Double.compare(width, that.width) == 0 &&
                Double.compare(height, that.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }
}
