package com.kmg.sync.dto;

import java.util.List;

public record UnitView(String locator, String description, List<String> requiredStores) {
}
