package com.di.starnova.quality;

import com.di.starnova.transform.Tables;
import com.di.starnova.util.RowFormatting;
import org.apache.beam.sdk.transforms.Count;
import org.apache.beam.sdk.transforms.Distinct;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.Filter;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.transforms.join.CoGbkResult;
import org.apache.beam.sdk.transforms.join.CoGroupByKey;
import org.apache.beam.sdk.transforms.join.KeyedPCollectionTuple;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.TupleTag;
import org.apache.beam.sdk.values.TypeDescriptors;

import java.util.List;

/**
 * Anti-join of a foreign-key column against the referenced key column: every distinct
 * foreign-key value absent from the referenced table is a violation with its occurrence count.
 *
 * <p>With {@code flagUnresolved} a null foreign key counts as the value {@code <null>};
 * otherwise null foreign keys are not checked.
 */
public class ReferentialIntegrityRule extends AbstractRule {

    private static final TupleTag<Long> REFERENCING = new TupleTag<>("referencing");
    private static final TupleTag<String> REFERENCED = new TupleTag<>("referenced");

    private final String referencedTable;
    private final String referencedColumn;
    private final boolean flagUnresolved;

    public ReferentialIntegrityRule(String table, String column,
                                    String referencedTable, String referencedColumn,
                                    boolean flagUnresolved) {
        super(RuleType.REFERENTIAL_INTEGRITY, table, column);
        this.referencedTable = referencedTable;
        this.referencedColumn = referencedColumn;
        this.flagUnresolved = flagUnresolved;
    }

    public String referencedTable() {
        return referencedTable;
    }

    boolean flagsUnresolved() {
        return flagUnresolved;
    }

    @Override
    public List<String> requiredTables() {
        return List.of(targetTable(), referencedTable);
    }

    @Override
    public String description() {
        return targetTable() + "." + column() + " references " + referencedTable + "." + referencedColumn
                + (flagUnresolved ? " (null is unresolved)" : "");
    }

    @Override
    public PCollection<KV<String, Long>> violations(PCollectionTuple tables) {
        boolean includeNulls = flagUnresolved;
        SerializableFunction<String, Boolean> checked = v -> includeNulls || !RowFormatting.NULL_TOKEN.equals(v);
        SerializableFunction<String, Boolean> present = v -> !RowFormatting.NULL_TOKEN.equals(v);

        PCollection<KV<String, Long>> referencing = tokens(Tables.get(tables, targetTable()), column(), id() + "/ForeignKeys")
                .apply(id() + "/Checked", Filter.by(checked))
                .apply(id() + "/CountForeignKeys", Count.perElement());
        PCollection<KV<String, String>> referenced = tokens(Tables.get(tables, referencedTable), referencedColumn, id() + "/Keys")
                .apply(id() + "/PresentKeys", Filter.by(present))
                .apply(id() + "/DistinctKeys", Distinct.create())
                .apply(id() + "/KeyKeys", MapElements
                        .into(TypeDescriptors.kvs(TypeDescriptors.strings(), TypeDescriptors.strings()))
                        .via((String k) -> KV.of(k, k)));

        return KeyedPCollectionTuple.of(REFERENCING, referencing)
                .and(REFERENCED, referenced)
                .apply(id() + "/CoGroup", CoGroupByKey.create())
                .apply(id() + "/Unmatched", ParDo.of(new UnmatchedFn()));
    }

    static class UnmatchedFn extends DoFn<KV<String, CoGbkResult>, KV<String, Long>> {
        @ProcessElement
        public void processElement(@Element KV<String, CoGbkResult> group, OutputReceiver<KV<String, Long>> out) {
            CoGbkResult result = group.getValue();
            Long occurrences = result.getOnly(REFERENCING, null);
            if (occurrences != null && !result.getAll(REFERENCED).iterator().hasNext()) {
                out.output(KV.of(group.getKey(), occurrences));
            }
        }
    }
}
