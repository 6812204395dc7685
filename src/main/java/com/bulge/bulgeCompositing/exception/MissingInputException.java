package com.bulge.bulgeCompositing.exception;

/**
 * A required raster or box source could not be located or decoded.
 */
public class MissingInputException extends PipelineException {

    public MissingInputException(Stage stage, String message) {
        super(stage, message);
    }

    public MissingInputException(Stage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
