package com.di.starnova.dimension;

import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.SchemaRegistry;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.FirstSeen;
import com.di.starnova.transform.LookupJoin;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.List;
import java.util.Locale;

/**
 * One row per {@code product_id}. The display category is the English translation of the
 * category name, formatted by {@link #formatCategory(String)}.
 */
public class ProductDimensionBuilder extends DimensionBuilder {

    public static final String MISSING_CATEGORY = "N/A";

    static final String ENGLISH = "product_category_name_english";

    /** Raw product columns plus the translated category. */
    static final Schema TRANSLATED = Schema.builder()
            .addFields(SchemaRegistry.schemaFor(TableNames.PRODUCTS).getFields())
            .addNullableField(ENGLISH, Schema.FieldType.STRING)
            .build();

    @Override
    public String tableName() {
        return TableNames.DIM_PRODUCT;
    }

    @Override
    public List<String> inputTables() {
        return List.of(TableNames.PRODUCTS, TableNames.TRANSLATION);
    }

    @Override
    protected String surrogateKeyField() {
        return "product_key";
    }

    @Override
    protected String naturalKeyField() {
        return "product_id";
    }

    @Override
    protected PCollection<Row> build(PCollectionTuple inputs) {
        Schema schema = outputSchema();
        PCollection<Row> translation = Tables.get(inputs, TableNames.TRANSLATION)
                .apply("FirstSeenTranslation", FirstSeen.byField(TableNames.TRANSLATION, "product_category_name").droppingNullKeys());
        return Tables.get(inputs, TableNames.PRODUCTS)
                .apply("FirstSeenProduct", FirstSeen.byField(tableName(), "product_id"))
                .apply("Translate", LookupJoin.onField(translation, "product_category_name", TRANSLATED)
                        .copy(ENGLISH, ENGLISH))
                .apply("ToProductRow", ParDo.of(new ToProductRowFn(schema)))
                .setRowSchema(schema);
    }

    /**
     * Underscores become spaces and every word is capitalized ({@code health_beauty} is
     * {@code Health Beauty}); a missing or blank name gives {@value #MISSING_CATEGORY}.
     */
    public static String formatCategory(String englishName) {
        if (englishName == null || englishName.isBlank()) {
            return MISSING_CATEGORY;
        }
        String lower = englishName.replace('_', ' ').toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean wordStart = true;
        for (char c : lower.toCharArray()) {
            sb.append(wordStart ? Character.toUpperCase(c) : c);
            wordStart = !Character.isLetter(c);
        }
        return sb.toString();
    }

    static class ToProductRowFn extends DoFn<Row, Row> {
        private final Schema schema;

        ToProductRowFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element Row row, OutputReceiver<Row> out) {
            String productId = row.getString("product_id");
            out.output(Row.withSchema(schema).addValues(
                    KeyDeriver.surrogateKey(KeyDeriver.PRODUCT, productId),
                    productId,
                    row.getString("product_category_name"),
                    formatCategory(row.getString(ENGLISH)),
                    row.getInt32("product_photos_qty"),
                    row.getInt32("product_name_lenght"),
                    row.getInt32("product_description_lenght")).build());
        }
    }
}
