package com.di.starnova.quality;

import com.di.starnova.config.DataQualityConfig;
import com.di.starnova.schema.TableNames;

import java.util.ArrayList;
import java.util.List;

/**
 * The rule battery run against every build.
 */
public final class StandardRules {

    private StandardRules() {}

    public static List<DataQualityRule> battery(DataQualityConfig config) {
        List<DataQualityRule> rules = new ArrayList<>();

        // key integrity, one per dimension
        rules.add(new KeyIntegrityRule(TableNames.DIM_GEOLOCATION, "geolocation_key"));
        rules.add(new KeyIntegrityRule(TableNames.DIM_CUSTOMER, "customer_key"));
        rules.add(new KeyIntegrityRule(TableNames.DIM_PRODUCT, "product_key"));
        rules.add(new KeyIntegrityRule(TableNames.DIM_SELLER, "seller_key"));
        rules.add(new KeyIntegrityRule(TableNames.DIM_TIME, "time_key"));

        // fact foreign keys; an unresolved lookup is a violation
        rules.add(new ReferentialIntegrityRule(TableNames.FACT_SALES, "product_key", TableNames.DIM_PRODUCT, "product_key", true));
        rules.add(new ReferentialIntegrityRule(TableNames.FACT_SALES, "customer_key", TableNames.DIM_CUSTOMER, "customer_key", true));
        rules.add(new ReferentialIntegrityRule(TableNames.FACT_SALES, "seller_key", TableNames.DIM_SELLER, "seller_key", true));
        rules.add(new ReferentialIntegrityRule(TableNames.FACT_SALES, "time_key", TableNames.DIM_TIME, "time_key", true));

        // zip prefixes without geolocation data are legitimate
        rules.add(new ReferentialIntegrityRule(TableNames.DIM_CUSTOMER, "geolocation_key", TableNames.DIM_GEOLOCATION, "geolocation_key", false));
        rules.add(new ReferentialIntegrityRule(TableNames.DIM_SELLER, "geolocation_key", TableNames.DIM_GEOLOCATION, "geolocation_key", false));

        rules.add(new AcceptedValuesRule(TableNames.FACT_SALES, "order_status", config.getAcceptedOrderStatus()));
        rules.add(new NumericRangeRule(TableNames.FACT_SALES, "price", NumericPredicate.nonNegative()));
        rules.add(new NumericRangeRule(TableNames.FACT_SALES, "freight_value", NumericPredicate.nonNegative()));
        return rules;
    }
}
