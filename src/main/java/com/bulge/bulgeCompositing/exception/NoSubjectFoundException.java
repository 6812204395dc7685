package com.bulge.bulgeCompositing.exception;

import lombok.Getter;

/**
 * Automatic box detection found no pixel at or above the intensity threshold.
 */
@Getter
public class NoSubjectFoundException extends PipelineException {
    private final int threshold;

    public NoSubjectFoundException(int threshold) {
        super(Stage.RESOLVE, "no pixel with intensity >= " + threshold + " in reference raster");
        this.threshold = threshold;
    }
}
