package io.github.sparkify;

/**
 * Thrown when an input dataset does not conform to its declared schema.
 * The whole read is rejected; no row is skipped.
 */
public class SchemaViolationException extends LakeReadException {

    public SchemaViolationException(String dataset, String inputPath, Throwable cause) {
        super(dataset, inputPath, formatMessage(dataset, inputPath, cause), cause);
    }

    private static String formatMessage(String dataset, String inputPath, Throwable cause) {
        String reason = cause == null ? "unknown cause" : rootMessage(cause);
        return String.format("Input '%s' at %s does not conform to its schema: %s", dataset, inputPath, reason);
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        if (msg.length() > 200) {
            return msg.substring(0, 197) + "...";
        }
        return msg;
    }
}
