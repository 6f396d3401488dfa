package com.kmg.sync.warehouse.byggmakker;

import com.kmg.sync.error.RunFailedException;
import com.kmg.sync.unit.ProcessingUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the Byggmakker units in dependency order. A failing unit is logged and the next one still runs; the run
 * itself fails afterwards if any unit failed.
 */
public class AllProcessorsUnit implements ProcessingUnit {
    private static final Logger log = LoggerFactory.getLogger(AllProcessorsUnit.class);

    private final List<ProcessingUnit> units;

    public AllProcessorsUnit(List<ProcessingUnit> units) {
        this.units = List.copyOf(units);
    }

    @Override
    public void run() {
        List<String> failed = new ArrayList<>();
        for (ProcessingUnit unit : units) {
            String name = unit.getClass().getSimpleName();
            try {
                unit.run();
            } catch (RuntimeException e) {
                log.error("Error running {}: {}", name, e.getMessage(), e);
                failed.add(name);
            }
        }
        if (!failed.isEmpty()) {
            throw new RunFailedException("Byggmakker processors failed: " + String.join(", ", failed));
        }
    }
}
