package io.github.sparkify;

/**
 * Thrown when a lake table could not be written or its commit cannot be confirmed.
 */
public class LakeWriteException extends LakeException {

    private final String table;
    private final String path;

    public LakeWriteException(String table, String path, String message) {
        super(String.format("Table '%s' at %s: %s", table, path, message));
        this.table = table;
        this.path = path;
    }

    public LakeWriteException(String table, String path, String message, Throwable cause) {
        super(String.format("Table '%s' at %s: %s", table, path, message), cause);
        this.table = table;
        this.path = path;
    }

    public String getTable() {
        return table;
    }

    public String getPath() {
        return path;
    }
}
