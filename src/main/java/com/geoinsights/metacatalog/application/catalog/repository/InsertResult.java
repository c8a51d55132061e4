package com.geoinsights.metacatalog.application.catalog.repository;

/**
 * insert 결과. 중복 식별자(Conflict)를 그 외 저장소 오류(Failed)와 타입으로 구분한다.
 */
public sealed interface InsertResult {

    String identifier();

    record Inserted(String identifier) implements InsertResult {}

    record Conflict(String identifier) implements InsertResult {}

    record Failed(String identifier, StorageError error) implements InsertResult {}
}
