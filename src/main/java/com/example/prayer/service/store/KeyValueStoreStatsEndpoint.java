package com.example.prayer.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Endpoint(id = "store-stats")
@RequiredArgsConstructor
public class KeyValueStoreStatsEndpoint {

    private final KeyValueStore keyValueStore;

    @ReadOperation
    public Map<String, Object> getStoreStats() {
        return keyValueStore.getStats();
    }
}
