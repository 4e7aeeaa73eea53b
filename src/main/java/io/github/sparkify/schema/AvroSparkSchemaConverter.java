package io.github.sparkify.schema;

import org.apache.avro.Schema;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.Metadata;
import org.apache.spark.sql.types.MetadataBuilder;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the flat Avro record schemas that declare lake inputs into Spark StructTypes.
 *
 * Only primitive fields and nullable unions of primitives are accepted. The lake
 * reads JSON in FAILFAST mode, so an unsupported type here has to be a hard error
 * rather than a silent fallback to string.
 */
public class AvroSparkSchemaConverter {

    private static final Logger LOG = LoggerFactory.getLogger(AvroSparkSchemaConverter.class);

    private AvroSparkSchemaConverter() {
    }

    /**
     * Convert a flat Avro record schema to a Spark StructType.
     *
     * @param avroSchema an Avro schema of type RECORD
     * @return a StructType with one nullable field per Avro field, in declaration order
     * @throws IllegalArgumentException if the schema is not a record or contains a non-primitive field
     */
    public static StructType toStructType(Schema avroSchema) {
        if (avroSchema.getType() != Schema.Type.RECORD) {
            throw new IllegalArgumentException("Expected a RECORD schema but got " + avroSchema.getType());
        }

        List<StructField> fields = new ArrayList<>();
        for (Schema.Field field : avroSchema.getFields()) {
            DataType sparkType = toSparkType(field.name(), field.schema());
            fields.add(DataTypes.createStructField(field.name(), sparkType, true, createMetadata(field)));
        }

        StructType result = DataTypes.createStructType(fields);
        LOG.debug("Converted Avro schema {} to Spark StructType with {} fields", avroSchema.getName(), fields.size());
        return result;
    }

    private static DataType toSparkType(String fieldName, Schema avroType) {
        if (avroType.getType() == Schema.Type.UNION) {
            Schema nonNullType = null;
            for (Schema branch : avroType.getTypes()) {
                if (branch.getType() == Schema.Type.NULL) {
                    continue;
                }
                if (nonNullType != null) {
                    throw new IllegalArgumentException("Field '" + fieldName + "' is a union of several non-null types");
                }
                nonNullType = branch;
            }
            if (nonNullType == null) {
                throw new IllegalArgumentException("Field '" + fieldName + "' is a union containing only null");
            }
            return toSparkType(fieldName, nonNullType);
        }

        switch (avroType.getType()) {
            case STRING:
            case ENUM:
                return DataTypes.StringType;
            case INT:
                return DataTypes.IntegerType;
            case LONG:
                return DataTypes.LongType;
            case FLOAT:
                return DataTypes.FloatType;
            case DOUBLE:
                return DataTypes.DoubleType;
            case BOOLEAN:
                return DataTypes.BooleanType;
            default:
                throw new IllegalArgumentException(
                        "Field '" + fieldName + "' has unsupported type " + avroType.getType());
        }
    }

    private static Metadata createMetadata(Schema.Field field) {
        MetadataBuilder builder = new MetadataBuilder();
        if (field.doc() != null && !field.doc().isEmpty()) {
            builder.putString("comment", field.doc());
        }
        builder.putString("avro.field.name", field.name());
        return builder.build();
    }
}
