package com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row;

/**
 * 카탈로그 레코드 한 건(레코드 테이블의 한 행)을 표현하는 Row 객체입니다.
 *
 * <p>추출 직후에는 {@code metadataSource}, {@code insertDate}가 비어 있으며,
 * 저장소에 insert될 때 채워진다.</p>
 *
 * @param identifier     레코드 식별자(PK)
 * @param typeName       문서 타입명 (예: csw:Record, gmd:MD_Metadata)
 * @param schemaUri      문서 스키마 URI
 * @param metadataSource 출처 ({@value #LOCAL_SOURCE} 또는 하베스트 원본 URL)
 * @param insertDate     최초 insert 시각(ISO-8601), 이후 변경되지 않음
 * @param rawDocument    원본 문서 텍스트(XML/JSON)
 * @param contentType    원본 문서 형식 (application/xml, application/json)
 * @param anyText        전문 검색용 텍스트
 * @param metadata       JSON 원본 사본(XML 문서는 null)
 * @param language       언어
 * @param title          제목
 * @param abstractText   초록
 * @param keywords       키워드(쉼표 구분)
 * @param resourceType   자원 유형
 * @param dateModified   수정일
 * @param wktGeometry    공간 범위(WKT)
 * @param links          링크(쉼표 구분)
 */
public record RecordRow(
        String identifier,
        String typeName,
        String schemaUri,
        String metadataSource,
        String insertDate,
        String rawDocument,
        String contentType,
        String anyText,
        String metadata,
        String language,
        String title,
        String abstractText,
        String keywords,
        String resourceType,
        String dateModified,
        String wktGeometry,
        String links
) {
    /** 자체 작성(하베스트되지 않은) 레코드의 출처 값 */
    public static final String LOCAL_SOURCE = "local";

    public static final String XML_CONTENT_TYPE = "application/xml";
    public static final String JSON_CONTENT_TYPE = "application/json";

    /**
     * 출처와 insert 시각을 채운 사본을 반환합니다.
     *
     * @param source     출처
     * @param insertedAt insert 시각
     * @return 새 RecordRow
     */
    public RecordRow withProvenance(String source, String insertedAt) {
        return new RecordRow(identifier, typeName, schemaUri, source, insertedAt,
                rawDocument, contentType, anyText, metadata, language, title, abstractText,
                keywords, resourceType, dateModified, wktGeometry, links);
    }

    /** JSON 문서 여부 */
    public boolean isJson() {
        return contentType != null && contentType.contains("json");
    }
}
