package com.geoinsights.metacatalog.infrastructure.mapper;

import com.geoinsights.metacatalog.infrastructure.input.document.DecodedDocument;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;

import java.util.List;

/**
 * 디코딩된 문서 하나를 0개 이상의 카탈로그 레코드로 변환한다.
 *
 * <p>반환된 레코드의 출처(mdsource)와 insert 시각은 비어 있으며 적재 단계에서 채워진다.</p>
 */
public interface RecordExtractor {

    /**
     * @param document 디코딩 성공 문서 (Json 또는 Xml)
     * @return 레코드 목록
     * @throws RecordExtractionException 레코드를 만들 수 없는 경우
     */
    List<RecordRow> extract(DecodedDocument document) throws RecordExtractionException;
}
