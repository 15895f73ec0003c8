package com.di.starnova.dimension;

import com.di.starnova.StarNovaTestData;
import com.di.starnova.keys.KeyDeriver;
import com.di.starnova.schema.TableNames;
import com.di.starnova.transform.Tables;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.di.starnova.StarNovaTestData.row;
import static com.di.starnova.StarNovaTestData.seller;
import static com.di.starnova.StarNovaTestData.table;

@DisplayName("SellerDimensionBuilder Tests")
class SellerDimensionBuilderTest {

    @Test
    @DisplayName("Should keep the first record per seller and resolve its geolocation")
    void testBuild() {
        Pipeline p = StarNovaTestData.newPipeline();
        PCollection<Row> dimGeo = table(p, TableNames.DIM_GEOLOCATION,
                GeolocationDimensionBuilderTest.dimGeolocation(13041, -22.75, -47.25, "campinas", "SP"));
        PCollection<Row> sellers = table(p, TableNames.SELLERS,
                seller(0, "s1", 13041, "campinas", "SP"),
                seller(1, "s1", 1037, "sao paulo", "SP"),
                seller(2, "s2", 88888, "curitiba", "PR"));

        PCollection<Row> dim = Tables.of(p, Map.of(TableNames.SELLERS, sellers, TableNames.DIM_GEOLOCATION, dimGeo))
                .apply(new SellerDimensionBuilder());

        PAssert.that(dim).containsInAnyOrder(
                row(TableNames.DIM_SELLER, KeyDeriver.surrogateKey(KeyDeriver.SELLER, "s1"), "s1", "campinas", "SP", 13041,
                        KeyDeriver.surrogateKey(KeyDeriver.GEOLOCATION, 13041)),
                row(TableNames.DIM_SELLER, KeyDeriver.surrogateKey(KeyDeriver.SELLER, "s2"), "s2", "curitiba", "PR", 88888, null));
        p.run().waitUntilFinish();
    }
}
