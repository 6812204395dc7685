package com.bulge.bulgeCompositing.boundingBox;

import com.bulge.bulgeCompositing.exception.InvalidBoundingBoxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoundingBoxTest {

    @Test
    public void centerAndHalfExtents() {
        BoundingBox box = new BoundingBox(10, 20, 90, 60);
        assertEquals(50.0, box.centerX());
        assertEquals(40.0, box.centerY());
        assertEquals(40.0, box.radiusX());
        assertEquals(20.0, box.radiusY());
    }

    @Test
    public void halfExtentNeverBelowOne() {
        BoundingBox box = new BoundingBox(3, 3, 4, 5);
        assertEquals(1.0, box.radiusX());
        assertEquals(1.0, box.radiusY());
    }

    @Test
    public void zeroAreaIsRejected() {
        assertThrows(InvalidBoundingBoxException.class, () -> new BoundingBox(5, 5, 5, 10));
        assertThrows(InvalidBoundingBoxException.class, () -> new BoundingBox(5, 9, 10, 2));
    }
}
