package com.thevig.backend.catalog;

public record CatalogResource(String id, String name, String abbreviation) {
}
