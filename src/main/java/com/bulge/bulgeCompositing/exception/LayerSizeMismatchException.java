package com.bulge.bulgeCompositing.exception;

import lombok.Getter;

/**
 * A layer that takes the subject mask does not have the reference raster's size.
 */
@Getter
public class LayerSizeMismatchException extends PipelineException {
    private final int layerIndex;

    public LayerSizeMismatchException(int layerIndex, int width, int height, int expectedWidth, int expectedHeight) {
        super(Stage.COMPOSITE, "layer " + layerIndex + " is " + width + "x" + height
                + " but the reference is " + expectedWidth + "x" + expectedHeight);
        this.layerIndex = layerIndex;
    }
}
