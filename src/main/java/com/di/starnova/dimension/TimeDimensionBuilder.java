package com.di.starnova.dimension;

import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.FirstSeen;
import com.di.starnova.transform.KeyByField;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.ReadableInstant;

import java.util.List;
import java.util.Locale;

/**
 * One row per distinct UTC purchase date in {@code orders}. Orders without a purchase
 * timestamp contribute nothing.
 */
public class TimeDimensionBuilder extends DimensionBuilder {

    static final String PURCHASE_TIMESTAMP = "order_purchase_timestamp";

    @Override
    public String tableName() {
        return TableNames.DIM_TIME;
    }

    @Override
    public List<String> inputTables() {
        return List.of(TableNames.ORDERS);
    }

    @Override
    protected String surrogateKeyField() {
        return "time_key";
    }

    @Override
    protected String naturalKeyField() {
        return "date";
    }

    @Override
    protected PCollection<Row> build(PCollectionTuple inputs) {
        Schema schema = outputSchema();
        return Tables.get(inputs, TableNames.ORDERS)
                .apply("DistinctDates", FirstSeen.byKey(tableName(), purchaseDateKey(), KeyByField.NullKeys.DROP))
                .apply("ToTimeRow", ParDo.of(new ToTimeRowFn(schema)))
                .setRowSchema(schema);
    }

    /** {@code yyyyMMdd} of an order's purchase date, null without a timestamp. */
    public static SerializableFunction<Row, String> purchaseDateKey() {
        return (Row r) -> {
            ReadableInstant ts = r.getDateTime(PURCHASE_TIMESTAMP);
            return ts == null ? null : String.valueOf(KeyDeriver.dateKey(ts));
        };
    }

    static class ToTimeRowFn extends DoFn<Row, Row> {
        private final Schema schema;

        ToTimeRowFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void processElement(@Element Row order, OutputReceiver<Row> out) {
            DateTime date = KeyDeriver.utcDate(order.getDateTime(PURCHASE_TIMESTAMP));
            out.output(Row.withSchema(schema).addValues(
                    KeyDeriver.dateKey(date),
                    date,
                    date.getYear(),
                    date.getMonthOfYear(),
                    date.getDayOfMonth(),
                    (date.getMonthOfYear() - 1) / 3 + 1,
                    date.dayOfWeek().getAsShortText(Locale.ENGLISH)).build());
        }
    }
}
