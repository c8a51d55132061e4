package com.geoinsights.metacatalog.application.catalog.repository;

/**
 * update 결과.
 */
public sealed interface UpdateResult {

    String identifier();

    record Updated(String identifier) implements UpdateResult {}

    record NotFound(String identifier) implements UpdateResult {}

    record Failed(String identifier, StorageError error) implements UpdateResult {}
}
