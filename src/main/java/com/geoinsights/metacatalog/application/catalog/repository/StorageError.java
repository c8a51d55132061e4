package com.geoinsights.metacatalog.application.catalog.repository;

import org.springframework.core.NestedExceptionUtils;

/**
 * 저장소가 중복 식별자 이외의 이유로 작업을 거부한 경우의 오류 정보.
 *
 * @param message DB가 보고한 메시지(전체 SQL 문장이 아닌 가장 구체적인 원인 메시지)
 * @param cause   원본 예외
 */
public record StorageError(String message, Throwable cause) {

    /**
     * 예외 체인에서 가장 구체적인 원인의 메시지를 뽑아 StorageError를 만든다.
     *
     * @param e 저장소 예외
     * @return StorageError
     */
    public static StorageError of(Throwable e) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
        String msg = root.getMessage() != null ? root.getMessage() : root.getClass().getName();
        return new StorageError(msg, e);
    }
}
