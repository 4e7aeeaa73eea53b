package io.github.sparkify;

/**
 * Base exception for all failures of a lake ETL run.
 */
public class LakeException extends RuntimeException {

    public LakeException(String message) {
        super(message);
    }

    public LakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
