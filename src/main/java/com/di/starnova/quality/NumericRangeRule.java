package com.di.starnova.quality;

import com.di.starnova.transform.Tables;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.transforms.Count;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

/**
 * Every row whose non-null value fails the predicate is a violation; the sample is the rendered row.
 */
public class NumericRangeRule extends AbstractRule {

    private final NumericPredicate predicate;

    public NumericRangeRule(String table, String column, NumericPredicate predicate) {
        super(RuleType.NUMERIC_RANGE, table, column);
        this.predicate = predicate;
    }

    @Override
    public String description() {
        return targetTable() + "." + column() + " " + predicate.describe();
    }

    @Override
    public PCollection<KV<String, Long>> violations(PCollectionTuple tables) {
        return Tables.get(tables, targetTable())
                .apply(id() + "/OutOfRange", ParDo.of(new OutOfRangeFn(column(), predicate)))
                .apply(id() + "/Count", Count.perElement());
    }

    static class OutOfRangeFn extends DoFn<Row, String> {
        private final String column;
        private final NumericPredicate predicate;

        OutOfRangeFn(String column, NumericPredicate predicate) {
            this.column = column;
            this.predicate = predicate;
        }

        @ProcessElement
        public void processElement(@Element Row row, OutputReceiver<String> out) {
            Object value = row.getValue(column);
            if (value instanceof Number && !predicate.test(((Number) value).doubleValue())) {
                out.output(RowFormatting.formatAllFields(row));
            }
        }
    }
}
