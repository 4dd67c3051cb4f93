package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.hearthwarrio.elementscout.core.dom.BoundingRect;

import java.util.Objects;

/**
 * Viewport-relative geometry captured at scan time.
 */
@JsonPropertyOrder({"x", "y", "width", "height"})
public final class ElementLocation {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    @JsonCreator
    public ElementLocation(
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height
    ) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static ElementLocation of(BoundingRect rect) {
        BoundingRect r = rect == null ? BoundingRect.EMPTY : rect;
        return new ElementLocation(r.getX(), r.getY(), r.getWidth(), r.getHeight());
    }

    @JsonProperty("x")
    public double getX() {
        return x;
    }

    @JsonProperty("y")
    public double getY() {
        return y;
    }

    @JsonProperty("width")
    public double getWidth() {
        return width;
    }

    @JsonProperty("height")
    public double getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "ElementLocation{" +
                "x=" + x +
                ", y=" + y +
                ", width=" + width +
                ", height=" + height +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementLocation)) return false;
        ElementLocation that = (ElementLocation) o;
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
