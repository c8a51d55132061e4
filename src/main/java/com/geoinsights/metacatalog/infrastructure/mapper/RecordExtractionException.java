package com.geoinsights.metacatalog.infrastructure.mapper;

/**
 * 디코딩된 문서에서 카탈로그 레코드를 만들 수 없을 때 발생한다.
 * (지원하지 않는 문서 형식, 식별자 누락 등)
 */
public class RecordExtractionException extends Exception {

    public RecordExtractionException(String message) {
        super(message);
    }

    public RecordExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
