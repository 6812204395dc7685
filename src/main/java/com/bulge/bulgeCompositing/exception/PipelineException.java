package com.bulge.bulgeCompositing.exception;

import lombok.Getter;

/**
 * Base failure of the bulge pipeline, tagged with the stage that failed.
 */
@Getter
public class PipelineException extends RuntimeException {
    private final Stage stage;

    public PipelineException(Stage stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PipelineException(Stage stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }
}
