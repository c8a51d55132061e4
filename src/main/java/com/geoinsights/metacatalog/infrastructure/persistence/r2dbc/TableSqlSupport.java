package com.geoinsights.metacatalog.infrastructure.persistence.r2dbc;

import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import org.springframework.r2dbc.core.DatabaseClient;

/**
 * 설정된 단일 레코드 테이블을 대상으로 하는 R2DBC SQL 처리용 베이스 클래스입니다.
 * <p>
 * 테이블명 보관, {@link RecordFilter} WHERE 절 조립/바인딩,
 * null-safe 바인딩 편의 메서드를 제공합니다.
 */
public abstract class TableSqlSupport {

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /** 대상 테이블명(설정에서 식별자 패턴으로 검증됨) */
    protected final String table;

    /**
     * @param db    R2DBC DatabaseClient
     * @param table 대상 테이블명
     */
    protected TableSqlSupport(DatabaseClient db, String table) {
        this.db = db;
        this.table = table;
    }

    /**
     * 필터가 비어 있으면 빈 문자열, 아니면 {@code " WHERE ..."}를 반환합니다.
     *
     * @param filter 조건
     * @return WHERE 절
     */
    protected String whereClause(RecordFilter filter) {
        return filter.isEmpty() ? "" : " WHERE " + filter.where();
    }

    /**
     * 필터 값들을 {@code f0, f1 ...} 이름으로 바인딩합니다.
     *
     * @param spec   바인딩 대상 spec
     * @param filter 조건
     * @return 바인딩이 적용된 spec
     */
    protected DatabaseClient.GenericExecuteSpec bindFilter(
            DatabaseClient.GenericExecuteSpec spec, RecordFilter filter
    ) {
        for (int i = 0; i < filter.values().size(); i++) {
            spec = spec.bind("f" + i, filter.values().get(i));
        }
        return spec;
    }

    /**
     * 값이 null인 경우 {@code bindNull}, 아니면 {@code bind}를 수행하는 null-safe 바인딩 헬퍼입니다.
     *
     * @param spec  바인딩 대상 spec
     * @param name  파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type  null 바인딩 시 사용할 타입
     * @param <V>   값 타입
     * @return 바인딩이 적용된 spec
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }
}
