package com.di.starnova.schema;

import java.util.List;

/**
 * Names of every table the pipeline reads or produces. Output names double as the
 * published directory names under {@code data.output_path}.
 */
public final class TableNames {

    private TableNames() {}

    // Raw source tables
    public static final String CUSTOMERS = "customers";
    public static final String SELLERS = "sellers";
    public static final String PRODUCTS = "products";
    public static final String ORDERS = "orders";
    public static final String ORDER_ITEMS = "order_items";
    public static final String TRANSLATION = "translation";
    public static final String GEOLOCATION = "geolocation";

    // Dimensional model
    public static final String DIM_GEOLOCATION = "dim_geolocation";
    public static final String DIM_CUSTOMER = "dim_customer";
    public static final String DIM_PRODUCT = "dim_product";
    public static final String DIM_SELLER = "dim_seller";
    public static final String DIM_TIME = "dim_time";
    public static final String FACT_SALES = "fact_sales";

    public static final List<String> RAW_TABLES = List.of(
            CUSTOMERS, SELLERS, PRODUCTS, ORDERS, ORDER_ITEMS, TRANSLATION, GEOLOCATION);

    /** Build order: geolocation first, customer and seller reference it. */
    public static final List<String> DIMENSION_TABLES = List.of(
            DIM_GEOLOCATION, DIM_CUSTOMER, DIM_PRODUCT, DIM_SELLER, DIM_TIME);

    public static final List<String> OUTPUT_TABLES = List.of(
            DIM_GEOLOCATION, DIM_CUSTOMER, DIM_PRODUCT, DIM_SELLER, DIM_TIME, FACT_SALES);
}
