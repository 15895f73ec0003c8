package com.di.starnova.transform;

import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.RowCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.Flatten;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.transforms.join.CoGbkResult;
import org.apache.beam.sdk.transforms.join.CoGroupByKey;
import org.apache.beam.sdk.transforms.join.KeyedPCollectionTuple;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TupleTag;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Left lookup of main rows against a keyed lookup table.
 *
 * <p>Every main row yields exactly one output row of {@code outputSchema}. Output fields listed in
 * the copy mapping take the matched lookup row's value (null when nothing matches or the main
 * key is null); every other output field is carried over from the main row by name, or null if
 * the main row does not have it. When several lookup rows share a key the earliest by
 * {@link RowOrder} wins.
 */
public class LookupJoin extends PTransform<PCollection<Row>, PCollection<Row>> {

    private static final TupleTag<Row> MAIN = new TupleTag<>("main");
    private static final TupleTag<Row> LOOKUP = new TupleTag<>("lookup");

    private final transient PCollection<Row> lookup;
    private final SerializableFunction<Row, String> mainKeyFn;
    private final SerializableFunction<Row, String> lookupKeyFn;
    private final Schema outputSchema;
    private final LinkedHashMap<String, String> copies = new LinkedHashMap<>();

    private LookupJoin(PCollection<Row> lookup,
                       SerializableFunction<Row, String> mainKeyFn,
                       SerializableFunction<Row, String> lookupKeyFn,
                       Schema outputSchema) {
        this.lookup = lookup;
        this.mainKeyFn = mainKeyFn;
        this.lookupKeyFn = lookupKeyFn;
        this.outputSchema = outputSchema;
    }

    public static LookupJoin against(PCollection<Row> lookup,
                                     SerializableFunction<Row, String> mainKeyFn,
                                     SerializableFunction<Row, String> lookupKeyFn,
                                     Schema outputSchema) {
        return new LookupJoin(Objects.requireNonNull(lookup, "lookup"), mainKeyFn, lookupKeyFn, outputSchema);
    }

    /** Joins on equal field values of the same name on both sides. */
    public static LookupJoin onField(PCollection<Row> lookup, String field, Schema outputSchema) {
        return against(lookup, KeyByField.field(field), KeyByField.field(field), outputSchema);
    }

    /** Copies {@code lookupField} of the matched row into {@code outputField}. */
    public LookupJoin copy(String lookupField, String outputField) {
        if (!outputSchema.hasField(outputField)) {
            throw new IllegalArgumentException("Output schema has no field '" + outputField + "'");
        }
        copies.put(outputField, lookupField);
        return this;
    }

    @Override
    public PCollection<Row> expand(PCollection<Row> input) {
        Schema mainSchema = Objects.requireNonNull(input.getSchema(), "LookupJoin main input must have a schema");
        Schema lookupSchema = Objects.requireNonNull(lookup.getSchema(), "LookupJoin lookup input must have a schema");
        for (String source : copies.values()) {
            if (!lookupSchema.hasField(source)) {
                throw new IllegalArgumentException("Lookup schema has no field '" + source + "'");
            }
        }
        Merge merge = new Merge(outputSchema, new LinkedHashMap<>(copies));

        PCollection<Row> unkeyed = input
                .apply("UnresolvableKeys", ParDo.of(new NullKeyFn(mainKeyFn, merge)))
                .setRowSchema(outputSchema);

        PCollection<KV<String, Row>> keyedMain = input
                .apply("KeyMain", ParDo.of(new KeyByField("lookup main", mainKeyFn, KeyByField.NullKeys.DROP)))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), RowCoder.of(mainSchema)));
        PCollection<KV<String, Row>> keyedLookup = lookup
                .apply("KeyLookup", ParDo.of(new KeyByField("lookup table", lookupKeyFn, KeyByField.NullKeys.DROP)))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), RowCoder.of(lookupSchema)));

        PCollection<Row> joined = KeyedPCollectionTuple.of(MAIN, keyedMain)
                .and(LOOKUP, keyedLookup)
                .apply("CoGroup", CoGroupByKey.create())
                .apply("Merge", ParDo.of(new MergeGroupFn(merge)))
                .setRowSchema(outputSchema);

        return PCollectionList.of(unkeyed).and(joined)
                .apply("Combine", Flatten.pCollections())
                .setRowSchema(outputSchema);
    }

    static class Merge implements Serializable {
        private final Schema outputSchema;
        private final Map<String, String> copies;

        Merge(Schema outputSchema, Map<String, String> copies) {
            this.outputSchema = outputSchema;
            this.copies = copies;
        }

        Row apply(Row main, Row match) {
            List<Object> values = new ArrayList<>(outputSchema.getFieldCount());
            for (Schema.Field field : outputSchema.getFields()) {
                String name = field.getName();
                Object value;
                if (copies.containsKey(name)) {
                    value = match == null ? null : match.getValue(copies.get(name));
                } else {
                    value = main.getSchema().hasField(name) ? main.getValue(name) : null;
                }
                values.add(value);
            }
            return Row.withSchema(outputSchema).addValues(values).build();
        }
    }

    static class NullKeyFn extends DoFn<Row, Row> {
        private final SerializableFunction<Row, String> keyFn;
        private final Merge merge;

        NullKeyFn(SerializableFunction<Row, String> keyFn, Merge merge) {
            this.keyFn = keyFn;
            this.merge = merge;
        }

        @ProcessElement
        public void processElement(@Element Row row, OutputReceiver<Row> out) {
            if (keyFn.apply(row) == null) {
                out.output(merge.apply(row, null));
            }
        }
    }

    static class MergeGroupFn extends DoFn<KV<String, CoGbkResult>, Row> {
        private final Merge merge;

        MergeGroupFn(Merge merge) {
            this.merge = merge;
        }

        @ProcessElement
        public void processElement(@Element KV<String, CoGbkResult> group, OutputReceiver<Row> out) {
            Row match = null;
            for (Row candidate : group.getValue().getAll(LOOKUP)) {
                match = match == null ? candidate : RowOrder.earlier(match, candidate);
            }
            for (Row main : group.getValue().getAll(MAIN)) {
                out.output(merge.apply(main, match));
            }
        }
    }
}
