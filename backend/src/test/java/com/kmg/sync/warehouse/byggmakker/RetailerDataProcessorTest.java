package com.kmg.sync.warehouse.byggmakker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetailerDataProcessorTest {

    @Test
    void productUrl_slugFromName() {
        assertEquals("https://www.byggmakker.no/produkt/Terrassebord-28x120-mm-impregnert/7020000000011",
                RetailerDataProcessor.productUrl("  Terrassebord 28x120 mm, impregnert!  ", "7020000000011"));
        assertEquals("https://www.byggmakker.no/produkt/Skrue-4-0x40/7020000000028",
                RetailerDataProcessor.productUrl("--Skrue 4,0x40--", "7020000000028"));
    }
}
