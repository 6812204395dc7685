package com.bulge.bulgeCompositing.boundingBox;

import com.bulge.bulgeCompositing.exception.InvalidBoundingBoxException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Integer box (minX, minY, maxX, maxY). The warp is active inside its inscribed ellipse.
 */
@Getter
@EqualsAndHashCode
public final class BoundingBox {
    private final int minX;
    private final int minY;
    private final int maxX;
    private final int maxY;

    public BoundingBox(int minX, int minY, int maxX, int maxY) {
        if (minX >= maxX || minY >= maxY) {
            throw new InvalidBoundingBoxException(minX, minY, maxX, maxY);
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    /** Center pixel column, rounded down when the width is odd so a real pixel sits there. */
    public double centerX() {
        return Math.floorDiv(minX + maxX, 2);
    }

    /** Center pixel row, rounded down like {@link #centerX()}. */
    public double centerY() {
        return Math.floorDiv(minY + maxY, 2);
    }

    /** Half width, never below 1. */
    public double radiusX() {
        return Math.max(1.0, (maxX - minX) / 2.0);
    }

    /** Half height, never below 1. */
    public double radiusY() {
        return Math.max(1.0, (maxY - minY) / 2.0);
    }

    public int[] toArray() {
        return new int[]{minX, minY, maxX, maxY};
    }

    @Override
    public String toString() {
        return "(" + minX + "," + minY + "," + maxX + "," + maxY + ")";
    }
}
