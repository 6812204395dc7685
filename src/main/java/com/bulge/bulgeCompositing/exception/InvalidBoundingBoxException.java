package com.bulge.bulgeCompositing.exception;

public class InvalidBoundingBoxException extends PipelineException {

    public InvalidBoundingBoxException(int minX, int minY, int maxX, int maxY) {
        super(Stage.RESOLVE, "bounding box (" + minX + "," + minY + "," + maxX + "," + maxY + ") has zero or negative area");
    }
}
