package com.geoinsights.metacatalog.infrastructure.input.document;

import org.w3c.dom.Document;
import tools.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * 문서 디코딩 결과. JSON / XML 두 성공 형태와 실패 형태 중 하나다.
 */
public sealed interface DecodedDocument {

    /** 원본 파일 경로 */
    Path source();

    /**
     * JSON 문서.
     *
     * @param source 원본 파일
     * @param tree   파싱된 JSON 트리
     * @param text   원본 텍스트
     */
    record Json(Path source, JsonNode tree, String text) implements DecodedDocument {}

    /**
     * XML 문서.
     *
     * @param source   원본 파일
     * @param document 파싱된 DOM
     * @param text     원본 텍스트
     */
    record Xml(Path source, Document document, String text) implements DecodedDocument {}

    /**
     * 디코딩 실패.
     *
     * @param source 원본 파일
     * @param kind   실패 종류
     * @param reason 사람이 읽을 수 있는 사유
     * @param cause  원본 예외
     */
    record Failed(Path source, FailureKind kind, String reason, Throwable cause) implements DecodedDocument {}

    /** 디코딩 실패 종류 */
    enum FailureKind {
        /** JSON도 아니고 well-formed XML도 아님 */
        MALFORMED_DOCUMENT,
        /** 읽기 실패 등 그 외 예기치 못한 오류 */
        DECODE_FAILURE
    }
}
