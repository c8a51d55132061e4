package com.geoinsights.metacatalog.application.admin;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.repo.MaintenanceRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 레코드 테이블 관리 작업(전체 삭제, 인덱스 재구성, 최적화) 서비스입니다.
 */
@Service
public class CatalogMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(CatalogMaintenanceService.class);

    private final CatalogRepository repository;
    private final MaintenanceRepo maintenance;

    public CatalogMaintenanceService(CatalogRepository repository, MaintenanceRepo maintenance) {
        this.repository = repository;
        this.maintenance = maintenance;
    }

    /**
     * 모든 레코드를 삭제합니다. 출처(local/하베스트)를 가리지 않습니다.
     *
     * @return 삭제 건수
     */
    public Mono<Long> deleteAll() {
        return repository.delete(RecordFilter.all())
                .doOnNext(n -> log.info("Deleted {} records", n));
    }

    /**
     * @return 완료 신호
     */
    public Mono<Void> rebuildIndexes() {
        return maintenance.rebuildIndexes()
                .doOnSuccess(v -> log.info("Indexes rebuilt"));
    }

    /**
     * @return 완료 신호
     */
    public Mono<Void> optimize() {
        return maintenance.optimize()
                .doOnSuccess(v -> log.info("Database optimized"));
    }
}
