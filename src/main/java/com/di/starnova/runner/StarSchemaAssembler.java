package com.di.starnova.runner;

import com.di.starnova.dimension.CustomerDimensionBuilder;
import com.di.starnova.dimension.DimensionBuilder;
import com.di.starnova.dimension.GeolocationDimensionBuilder;
import com.di.starnova.dimension.ProductDimensionBuilder;
import com.di.starnova.dimension.SellerDimensionBuilder;
import com.di.starnova.dimension.TimeDimensionBuilder;
import com.di.starnova.fact.FactBuilder;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.Row;

import java.util.List;

/**
 * Wires the dimension builders and the fact builder onto a tuple of raw tables.
 * Each step returns the input tuple extended with the tables it produced.
 */
public final class StarSchemaAssembler {

    private StarSchemaAssembler() {}

    /** Dimension builders in dependency order: geolocation before customer and seller. */
    public static List<DimensionBuilder> dimensionBuilders() {
        return List.of(
                new GeolocationDimensionBuilder(),
                new CustomerDimensionBuilder(),
                new ProductDimensionBuilder(),
                new SellerDimensionBuilder(),
                new TimeDimensionBuilder());
    }

    public static PCollectionTuple withDimensions(PCollectionTuple raw) {
        PCollectionTuple tables = raw;
        for (DimensionBuilder builder : dimensionBuilders()) {
            PCollection<Row> dimension = tables.apply("Build " + builder.tableName(), builder);
            tables = Tables.with(tables, builder.tableName(), dimension);
        }
        return tables;
    }

    public static PCollectionTuple withFact(PCollectionTuple tables) {
        PCollection<Row> fact = tables.apply("Build " + TableNames.FACT_SALES, new FactBuilder());
        return Tables.with(tables, TableNames.FACT_SALES, fact);
    }
}
