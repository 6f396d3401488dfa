package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.error.RunFailedException;
import com.kmg.sync.unit.ProcessingUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AllProcessorsUnitTest {

    @Test
    void failingUnitDoesNotStopTheRest() {
        List<String> ran = new ArrayList<>();
        ProcessingUnit base = () -> ran.add("base");
        ProcessingUnit stores = () -> {
            ran.add("stores");
            throw new IllegalStateException("stores down");
        };
        ProcessingUnit retailer = () -> ran.add("retailer");
        ProcessingUnit prices = () -> ran.add("prices");

        AllProcessorsUnit all = new AllProcessorsUnit(List.of(base, stores, retailer, prices));

        RunFailedException e = assertThrows(RunFailedException.class, all::run);
        assertEquals(List.of("base", "stores", "retailer", "prices"), ran);
        assertTrue(e.getMessage().startsWith("Byggmakker processors failed"));
    }

    @Test
    void allSucceed() {
        List<String> ran = new ArrayList<>();
        new AllProcessorsUnit(List.of(() -> ran.add("a"), () -> ran.add("b"))).run();
        assertEquals(List.of("a", "b"), ran);
    }
}
