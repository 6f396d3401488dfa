package com.kmg.sync.warehouse.byggmakker;

import java.util.Set;

public final class Byggmakker {
    public static final String GROUP = "byggmakker";
    public static final long RETAILER_ID = 1;

    public static final String RAW_DATA = "raw_data";
    public static final String SVENN_PRODUCTS = "svenn_products";
    public static final Set<String> STORES = Set.of(RAW_DATA, SVENN_PRODUCTS);

    private Byggmakker() {
    }
}
