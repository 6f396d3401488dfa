package com.kmg.sync.unit;

import com.kmg.sync.error.ConfigurationException;
import com.kmg.sync.error.ResolutionException;
import com.kmg.sync.error.UnitNotFoundException;
import com.kmg.sync.store.StoreConnectionManager;
import com.kmg.sync.store.StoreConnectionManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class ProcessingUnitResolver {
    private static final Logger log = LoggerFactory.getLogger(ProcessingUnitResolver.class);

    private final Map<String, ProcessingUnitDefinition> definitions;
    private final StoreConnectionManagerFactory connectionManagerFactory;

    public ProcessingUnitResolver(
            List<ProcessingUnitDefinition> definitions,
            StoreConnectionManagerFactory connectionManagerFactory
    ) {
        Map<String, ProcessingUnitDefinition> byLocator = new TreeMap<>();
        for (ProcessingUnitDefinition definition : definitions) {
            String key = definition.locator().toString();
            if (byLocator.putIfAbsent(key, definition) != null) {
                throw new IllegalStateException("Duplicate processing unit registered for " + key);
            }
        }
        this.definitions = Collections.unmodifiableMap(byLocator);
        this.connectionManagerFactory = connectionManagerFactory;
        log.info("Registered {} processing units: {}", byLocator.size(), byLocator.keySet());
    }

    public boolean exists(UnitLocator locator) {
        return definitions.containsKey(locator.toString());
    }

    public List<UnitLocator> locators() {
        return definitions.values().stream().map(ProcessingUnitDefinition::locator).toList();
    }

    public List<ProcessingUnitDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public ResolvedUnit resolve(String group, String name) {
        return resolve(new UnitLocator(group, name));
    }

    /**
     * Builds a fresh unit for every call; nothing is cached between runs.
     */
    public ResolvedUnit resolve(UnitLocator locator) {
        ProcessingUnitDefinition definition = definitions.get(locator.toString());
        if (definition == null) {
            throw new UnitNotFoundException(locator.toString());
        }

        StoreConnectionManager stores = connectionManagerFactory.open(definition.requiredStores());
        try {
            ProcessingUnit unit = definition.create(stores);
            if (unit == null) {
                throw new ResolutionException("Processing unit " + locator + " produced no instance");
            }
            log.info("Resolved processing unit {}", locator);
            return new ResolvedUnit(locator, unit, stores);
        } catch (ResolutionException | ConfigurationException e) {
            stores.close();
            throw e;
        } catch (RuntimeException e) {
            stores.close();
            throw new ResolutionException("Failed to load processing unit " + locator + ": " + e.getMessage(), e);
        }
    }
}
