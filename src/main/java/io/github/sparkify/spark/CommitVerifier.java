package io.github.sparkify.spark;

import io.github.sparkify.LakeWriteException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Confirms that a table write has been committed before a dependent phase reads it.
 *
 * Spark's file committer writes a {@code _SUCCESS} marker at the table root only after every
 * task output has been moved into place, so the marker is the durable signal that readers
 * will see the complete table.
 */
public class CommitVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(CommitVerifier.class);

    public static final String SUCCESS_MARKER = "_SUCCESS";

    private final Configuration hadoopConf;

    public CommitVerifier(Configuration hadoopConf) {
        this.hadoopConf = hadoopConf;
    }

    /**
     * @throws LakeWriteException if the table directory or its commit marker is missing
     */
    public void verify(LakeTable table, String outputRoot) {
        String tablePath = table.pathUnder(outputRoot);
        try {
            Path root = new Path(tablePath);
            FileSystem fs = root.getFileSystem(hadoopConf);
            if (!fs.exists(root)) {
                throw new LakeWriteException(table.tableName(), tablePath, "table has not been written");
            }
            if (!fs.exists(new Path(root, SUCCESS_MARKER))) {
                throw new LakeWriteException(table.tableName(), tablePath,
                        "no " + SUCCESS_MARKER + " marker, the write was not committed");
            }
        } catch (IOException e) {
            throw new LakeWriteException(table.tableName(), tablePath, "cannot check commit state", e);
        }
        LOG.info("{} table committed at {}", table.tableName(), tablePath);
    }
}
