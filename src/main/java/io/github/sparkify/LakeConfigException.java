package io.github.sparkify;

/**
 * Thrown at startup when configuration or credentials are missing or unusable.
 */
public class LakeConfigException extends LakeException {

    public LakeConfigException(String message) {
        super(message);
    }

    public LakeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
