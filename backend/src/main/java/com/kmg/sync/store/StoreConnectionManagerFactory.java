package com.kmg.sync.store;

import com.kmg.sync.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class StoreConnectionManagerFactory {
    private final SyncProperties properties;

    public StoreConnectionManagerFactory(SyncProperties properties) {
        this.properties = properties;
    }

    public StoreConnectionManager open(Collection<String> requiredStores) {
        return new StoreConnectionManager(properties.getStores(), requiredStores);
    }
}
