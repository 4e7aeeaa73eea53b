package io.github.sparkify;

/**
 * Thrown when an input dataset cannot be read: missing path, unreachable storage, denied access.
 */
public class LakeReadException extends LakeException {

    private final String dataset;
    private final String inputPath;

    public LakeReadException(String dataset, String inputPath, String message, Throwable cause) {
        super(message, cause);
        this.dataset = dataset;
        this.inputPath = inputPath;
    }

    /**
     * Returns the logical dataset name, e.g. {@code song_data}.
     */
    public String getDataset() {
        return dataset;
    }

    /**
     * Returns the input path or glob that was being read.
     */
    public String getInputPath() {
        return inputPath;
    }
}
