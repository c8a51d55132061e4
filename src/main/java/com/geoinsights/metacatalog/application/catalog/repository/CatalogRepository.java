package com.geoinsights.metacatalog.application.catalog.repository;

import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 레코드 저장소 경계.
 *
 * <p>모든 변경 작업은 단일 SQL 문장(원자적)으로 수행되며, 식별자 유일성은 저장소가 보장한다.
 * 파이프라인은 {@link InsertResult.Conflict}로 중복을 판별한다.</p>
 */
public interface CatalogRepository {

    /**
     * 레코드를 새로 저장한다.
     *
     * @param row        레코드
     * @param source     출처(local 또는 원본 URL)
     * @param insertDate 최초 insert 시각
     * @return Inserted / Conflict / Failed
     */
    Mono<InsertResult> insert(RecordRow row, String source, String insertDate);

    /**
     * 저장된 레코드의 내용을 갱신한다. identifier, mdsource, insert_date는 유지한다.
     *
     * @param row 레코드
     * @return Updated / NotFound / Failed
     */
    Mono<UpdateResult> update(RecordRow row);

    /**
     * 조건에 맞는 레코드를 삭제한다. {@link RecordFilter#all()}이면 전부 삭제한다.
     *
     * @param filter 조건
     * @return 삭제 건수
     */
    Mono<Long> delete(RecordFilter filter);

    /**
     * 조건에 맞는 레코드를 최대 maxResults건 조회한다.
     *
     * @param filter     조건
     * @param maxResults 최대 건수
     * @return (전체 일치 건수, 레코드 목록)
     */
    Mono<RecordPage> query(RecordFilter filter, int maxResults);

    /**
     * 조건에 맞는 레코드를 식별자 순으로 한 번에 흘려보낸다.
     *
     * @param filter 조건
     * @return 레코드 스트림
     */
    Flux<RecordRow> stream(RecordFilter filter);

    /**
     * @param filter 조건
     * @return 일치 건수
     */
    Mono<Long> count(RecordFilter filter);

    /**
     * @param identifier 식별자
     * @return 레코드(없으면 empty)
     */
    Mono<RecordRow> findByIdentifier(String identifier);
}
