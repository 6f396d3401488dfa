package com.kmg.sync.warehouse.byggmakker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.unit.ProcessingUnitDefinition;
import com.kmg.sync.unit.SimpleUnitDefinition;
import com.kmg.sync.unit.UnitLocator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ByggmakkerUnits {
    private final SyncProperties properties;
    private final ObjectMapper objectMapper;

    public ByggmakkerUnits(SyncProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Bean
    public ProcessingUnitDefinition byggmakkerBaseData() {
        return new SimpleUnitDefinition(locator("base_data"), Byggmakker.STORES,
                "Byggmakker products, EAN/NOBB codes and images",
                stores -> new BaseDataProcessor(stores, objectMapper, batchSize()));
    }

    @Bean
    public ProcessingUnitDefinition byggmakkerStoreData() {
        return new SimpleUnitDefinition(locator("store_data"), Byggmakker.STORES,
                "Byggmakker stores",
                stores -> new StoreDataProcessor(stores, batchSize()));
    }

    @Bean
    public ProcessingUnitDefinition byggmakkerRetailerData() {
        return new SimpleUnitDefinition(locator("retailer_data"), Byggmakker.STORES,
                "Byggmakker retailer products and categories",
                stores -> new RetailerDataProcessor(stores, batchSize()));
    }

    @Bean
    public ProcessingUnitDefinition byggmakkerPrices() {
        return new SimpleUnitDefinition(locator("prices"), Byggmakker.STORES,
                "Byggmakker store prices",
                stores -> new PriceProcessor(stores, batchSize()));
    }

    @Bean
    public ProcessingUnitDefinition byggmakkerAll() {
        return new SimpleUnitDefinition(locator("all"), Byggmakker.STORES,
                "All Byggmakker units in order",
                stores -> new AllProcessorsUnit(List.of(
                        new BaseDataProcessor(stores, objectMapper, batchSize()),
                        new StoreDataProcessor(stores, batchSize()),
                        new RetailerDataProcessor(stores, batchSize()),
                        new PriceProcessor(stores, batchSize())
                )));
    }

    private int batchSize() {
        return properties.getBatch().getDefaultSize();
    }

    private static UnitLocator locator(String name) {
        return new UnitLocator(Byggmakker.GROUP, name);
    }
}
