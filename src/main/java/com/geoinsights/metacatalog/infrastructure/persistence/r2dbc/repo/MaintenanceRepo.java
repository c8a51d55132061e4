package com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.repo;

import com.geoinsights.metacatalog.config.CatalogProperties;
import com.geoinsights.metacatalog.config.CatalogProperties.Dialect;
import com.geoinsights.metacatalog.infrastructure.persistence.r2dbc.TableSqlSupport;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 레코드 테이블 인덱스 재구성 및 저장공간 최적화를 수행하는 Repository입니다.
 * <p>
 * 구문은 DB 방언별로 다르며, 각 구문은 순서대로 하나씩 실행합니다.
 */
@Component
public class MaintenanceRepo extends TableSqlSupport {

    private final Dialect dialect;

    /**
     * @param db    R2DBC DatabaseClient
     * @param props 카탈로그 설정(테이블명, 방언)
     */
    public MaintenanceRepo(DatabaseClient db, CatalogProperties props) {
        super(db, props.repository().table());
        this.dialect = props.repository().dialect();
    }

    /**
     * 레코드 테이블의 인덱스를 재구성합니다.
     * <p>
     * H2에는 인덱스 재구성 구문이 없어 통계 갱신으로 대신합니다.
     *
     * @return 완료 신호
     */
    public Mono<Void> rebuildIndexes() {
        return executeAll(switch (dialect) {
            case MYSQL -> List.of("ALTER TABLE " + table + " ENGINE=InnoDB");
            case H2 -> List.of("ANALYZE TABLE " + table);
        });
    }

    /**
     * 저장공간을 정리하고 옵티마이저 통계를 갱신합니다.
     *
     * @return 완료 신호
     */
    public Mono<Void> optimize() {
        return executeAll(switch (dialect) {
            case MYSQL -> List.of("OPTIMIZE TABLE " + table, "ANALYZE TABLE " + table);
            case H2 -> List.of("ANALYZE");
        });
    }

    /**
     * 구문들을 순차(concat) 실행합니다.
     *
     * @param statements 실행할 구문
     * @return 완료 신호
     */
    private Mono<Void> executeAll(List<String> statements) {
        return Flux.fromIterable(statements)
                .concatMap(sql -> db.sql(sql).then())
                .then();
    }
}
