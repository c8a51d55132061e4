package com.geoinsights.metacatalog.application.sync;

/**
 * @param identifier 레코드 식별자 (디코딩/추출 실패처럼 레코드가 없으면 null)
 * @param outcome    결과
 */
public record RecordOutcome(String identifier, SyncOutcome outcome) {}
