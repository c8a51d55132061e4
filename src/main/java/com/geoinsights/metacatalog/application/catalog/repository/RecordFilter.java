package com.geoinsights.metacatalog.application.catalog.repository;

import java.util.List;

/**
 * 레코드 조회/삭제 조건.
 *
 * <p>WHERE 절 조각과 위치 순서대로의 바인딩 값을 묶는다. 바인딩 이름은 {@code :f0, :f1 ...}을 사용한다.
 * 빈 조건({@link #all()})은 전체 레코드를 의미한다.</p>
 *
 * @param where  WHERE 절 조각(빈 문자열이면 조건 없음)
 * @param values 바인딩 값
 */
public record RecordFilter(String where, List<Object> values) {

    /** 전체 레코드 */
    public static RecordFilter all() {
        return new RecordFilter("", List.of());
    }

    /** 하베스트된(로컬이 아닌) 레코드 */
    public static RecordFilter nonLocal() {
        return new RecordFilter("mdsource <> :f0", List.of("local"));
    }

    /** 식별자 단건 */
    public static RecordFilter identifier(String identifier) {
        return new RecordFilter("identifier = :f0", List.of(identifier));
    }

    /** 특정 출처 */
    public static RecordFilter source(String source) {
        return new RecordFilter("mdsource = :f0", List.of(source));
    }

    public boolean isEmpty() {
        return where == null || where.isBlank();
    }
}
