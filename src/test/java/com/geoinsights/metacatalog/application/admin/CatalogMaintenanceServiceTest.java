package com.geoinsights.metacatalog.application.admin;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.row.RecordRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

/**
 * {@link CatalogMaintenanceService} 통합 테스트 (H2).
 */
@DisplayName("레코드 테이블 관리 작업 테스트")
@SpringBootTest
@ActiveProfiles("test")
class CatalogMaintenanceServiceTest {

    @Autowired
    CatalogMaintenanceService service;
    @Autowired
    CatalogRepository repository;
    @Autowired
    DatabaseClient db;

    @BeforeEach
    void clean() {
        StepVerifier.create(db.sql("DELETE FROM records").fetch().rowsUpdated())
                .expectNextCount(1).verifyComplete();
    }

    static RecordRow row(String id) {
        return new RecordRow(id, "csw:Record", "http://www.opengis.net/cat/csw/2.0.2", null, null, "<a/>",
                RecordRow.XML_CONTENT_TYPE, null, null, null, null, null, null, null, null, null, null);
    }

    @DisplayName("전체 삭제는 local/하베스트 출처를 가리지 않고 모두 삭제")
    @Test
    void deleteAll_removesEverything() {
        StepVerifier.create(repository.insert(row("a"), "local", "2024-01-01T00:00:00Z")
                        .then(repository.insert(row("b"), "http://remote/csw", "2024-01-01T00:00:00Z")))
                .expectNextCount(1).verifyComplete();

        StepVerifier.create(service.deleteAll())
                .expectNext(2L).verifyComplete();
        StepVerifier.create(repository.count(RecordFilter.all()))
                .expectNext(0L).verifyComplete();
    }

    @DisplayName("인덱스 재구성/최적화 구문이 H2에서 정상 완료")
    @Test
    void rebuildAndOptimize_complete() {
        StepVerifier.create(service.rebuildIndexes()).verifyComplete();
        StepVerifier.create(service.optimize()).verifyComplete();
    }
}
