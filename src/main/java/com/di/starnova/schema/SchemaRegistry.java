package com.di.starnova.schema;

import com.di.starnova.exception.SchemaMismatchException;
import com.di.starnova.exception.UnknownTableException;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.Schema.FieldType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit column declarations for every raw input table and every dimensional output table.
 *
 * <p>Raw schemas mirror the source CSV headers (including the source's own spelling,
 * e.g. {@code product_name_lenght}) and end with {@link #SOURCE_ORDINAL}, the zero-based
 * position of the record in its file. Business columns are nullable at load time;
 * natural-key nullness is enforced by {@link com.di.starnova.keys.KeyDeriver}.
 *
 * <p>Output schemas declare the surrogate key of each dimension as non-null. Foreign keys are nullable.
 */
public final class SchemaRegistry {

    private SchemaRegistry() {}

    /** Technical column appended to every raw table: record position in its source file. */
    public static final String SOURCE_ORDINAL = "source_ordinal";

    private static final Map<String, Schema> SCHEMAS;

    static {
        Map<String, Schema> m = new LinkedHashMap<>();

        // ---------------- raw ----------------
        m.put(TableNames.CUSTOMERS, Schema.builder()
                .addNullableField("customer_id", FieldType.STRING)
                .addNullableField("customer_unique_id", FieldType.STRING)
                .addNullableField("customer_zip_code_prefix", FieldType.INT32)
                .addNullableField("customer_city", FieldType.STRING)
                .addNullableField("customer_state", FieldType.STRING)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.SELLERS, Schema.builder()
                .addNullableField("seller_id", FieldType.STRING)
                .addNullableField("seller_zip_code_prefix", FieldType.INT32)
                .addNullableField("seller_city", FieldType.STRING)
                .addNullableField("seller_state", FieldType.STRING)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.PRODUCTS, Schema.builder()
                .addNullableField("product_id", FieldType.STRING)
                .addNullableField("product_category_name", FieldType.STRING)
                .addNullableField("product_name_lenght", FieldType.INT32)
                .addNullableField("product_description_lenght", FieldType.INT32)
                .addNullableField("product_photos_qty", FieldType.INT32)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.ORDERS, Schema.builder()
                .addNullableField("order_id", FieldType.STRING)
                .addNullableField("customer_id", FieldType.STRING)
                .addNullableField("order_status", FieldType.STRING)
                .addNullableField("order_purchase_timestamp", FieldType.DATETIME)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.ORDER_ITEMS, Schema.builder()
                .addNullableField("order_id", FieldType.STRING)
                .addNullableField("order_item_id", FieldType.INT32)
                .addNullableField("product_id", FieldType.STRING)
                .addNullableField("seller_id", FieldType.STRING)
                .addNullableField("price", FieldType.DOUBLE)
                .addNullableField("freight_value", FieldType.DOUBLE)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.TRANSLATION, Schema.builder()
                .addNullableField("product_category_name", FieldType.STRING)
                .addNullableField("product_category_name_english", FieldType.STRING)
                .addInt64Field(SOURCE_ORDINAL)
                .build());
        m.put(TableNames.GEOLOCATION, Schema.builder()
                .addNullableField("geolocation_zip_code_prefix", FieldType.INT32)
                .addNullableField("geolocation_lat", FieldType.DOUBLE)
                .addNullableField("geolocation_lng", FieldType.DOUBLE)
                .addNullableField("geolocation_city", FieldType.STRING)
                .addNullableField("geolocation_state", FieldType.STRING)
                .addInt64Field(SOURCE_ORDINAL)
                .build());

        // ---------------- dimensional model ----------------
        m.put(TableNames.DIM_GEOLOCATION, Schema.builder()
                .addInt64Field("geolocation_key")
                .addInt32Field("zip_code_prefix")
                .addNullableField("latitude", FieldType.DOUBLE)
                .addNullableField("longitude", FieldType.DOUBLE)
                .addNullableField("city", FieldType.STRING)
                .addNullableField("state", FieldType.STRING)
                .build());
        m.put(TableNames.DIM_CUSTOMER, Schema.builder()
                .addInt64Field("customer_key")
                .addStringField("customer_unique_id")
                .addNullableField("city", FieldType.STRING)
                .addNullableField("state", FieldType.STRING)
                .addNullableField("zip_code_prefix", FieldType.INT32)
                .addNullableField("geolocation_key", FieldType.INT64)
                .build());
        m.put(TableNames.DIM_PRODUCT, Schema.builder()
                .addInt64Field("product_key")
                .addStringField("product_id")
                .addNullableField("category_name", FieldType.STRING)
                .addStringField("category")
                .addNullableField("photos_qty", FieldType.INT32)
                .addNullableField("name_length", FieldType.INT32)
                .addNullableField("description_length", FieldType.INT32)
                .build());
        m.put(TableNames.DIM_SELLER, Schema.builder()
                .addInt64Field("seller_key")
                .addStringField("seller_id")
                .addNullableField("city", FieldType.STRING)
                .addNullableField("state", FieldType.STRING)
                .addNullableField("zip_code_prefix", FieldType.INT32)
                .addNullableField("geolocation_key", FieldType.INT64)
                .build());
        m.put(TableNames.DIM_TIME, Schema.builder()
                .addInt64Field("time_key")
                .addDateTimeField("date")
                .addInt32Field("year")
                .addInt32Field("month")
                .addInt32Field("day")
                .addInt32Field("quarter")
                .addStringField("day_of_week")
                .build());
        m.put(TableNames.FACT_SALES, Schema.builder()
                .addNullableField("product_key", FieldType.INT64)
                .addNullableField("customer_key", FieldType.INT64)
                .addNullableField("seller_key", FieldType.INT64)
                .addNullableField("time_key", FieldType.INT64)
                .addNullableField("order_id", FieldType.STRING)
                .addNullableField("order_item_id", FieldType.INT32)
                .addNullableField("price", FieldType.DOUBLE)
                .addNullableField("freight_value", FieldType.DOUBLE)
                .addNullableField("order_status", FieldType.STRING)
                .build());

        SCHEMAS = Collections.unmodifiableMap(m);
    }

    /**
     * Returns the declared schema of a table.
     *
     * @throws UnknownTableException if the table is not registered
     */
    public static Schema schemaFor(String tableName) {
        Schema schema = tableName == null ? null : SCHEMAS.get(tableName);
        if (schema == null) {
            throw new UnknownTableException("Table '" + tableName + "' is not registered. Known tables: " + SCHEMAS.keySet());
        }
        return schema;
    }

    static boolean isRegistered(String tableName) {
        return tableName != null && SCHEMAS.containsKey(tableName);
    }

    static Set<String> registeredTables() {
        return SCHEMAS.keySet();
    }

    /** Source tables, in extraction order. */
    public static List<String> rawTables() {
        return TableNames.RAW_TABLES;
    }

    /** Dimension tables, in build order. */
    public static List<String> dimensionTables() {
        return TableNames.DIMENSION_TABLES;
    }

    /**
     * Verifies that {@code actual} declares exactly the registered columns of {@code tableName},
     * in order, with the same types and nullability. No coercion is attempted.
     *
     * @throws SchemaMismatchException on the first difference found
     * @throws UnknownTableException   if the table is not registered
     */
    public static void requireConforms(String tableName, Schema actual) {
        Schema expected = schemaFor(tableName);
        if (actual == null) {
            throw new SchemaMismatchException("Table '" + tableName + "' has no schema attached");
        }
        List<Schema.Field> exp = expected.getFields();
        List<Schema.Field> act = actual.getFields();
        if (exp.size() != act.size()) {
            throw new SchemaMismatchException(String.format(
                    "Table '%s' declares %d columns, registry expects %d: %s vs %s",
                    tableName, act.size(), exp.size(), act, exp));
        }
        for (int i = 0; i < exp.size(); i++) {
            Schema.Field e = exp.get(i);
            Schema.Field a = act.get(i);
            if (!e.getName().equals(a.getName())) {
                throw new SchemaMismatchException(String.format(
                        "Table '%s' column %d is '%s', registry expects '%s'", tableName, i, a.getName(), e.getName()));
            }
            if (!e.getType().equals(a.getType())) {
                throw new SchemaMismatchException(String.format(
                        "Table '%s' column '%s' is %s, registry expects %s", tableName, e.getName(), describe(a.getType()), describe(e.getType())));
            }
        }
    }

    private static String describe(FieldType type) {
        return type.getTypeName() + (Boolean.TRUE.equals(type.getNullable()) ? " NULL" : " NOT NULL");
    }
}
