package com.geoinsights.metacatalog.application.catalog.repository;

import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;

import java.util.List;

/**
 * 조회 결과.
 *
 * @param matched 조건에 일치하는 전체 건수(maxResults와 무관)
 * @param records 식별자 순으로 최대 maxResults건
 */
public record RecordPage(long matched, List<RecordRow> records) {}
