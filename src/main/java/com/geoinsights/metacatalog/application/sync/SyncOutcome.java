package com.geoinsights.metacatalog.application.sync;

/**
 * 레코드(또는 파일) 단위 적재 결과.
 */
public enum SyncOutcome {
    /** 새로 저장됨 */
    INSERTED,
    /** 기존 레코드를 덮어씀 (forceUpdate) */
    UPDATED,
    /** 파일을 디코딩하지 못함 */
    SKIPPED_DECODE_ERROR,
    /** 문서에서 레코드를 추출하지 못함 */
    SKIPPED_EXTRACT_ERROR,
    /** 식별자가 이미 존재하고 덮어쓰기가 꺼져 있음 */
    SKIPPED_CONFLICT,
    /** 저장소가 작업을 거부함 */
    FAILED_STORAGE;

    public boolean isStored() {
        return this == INSERTED || this == UPDATED;
    }
}
