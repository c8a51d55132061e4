package com.geoinsights.metacatalog.bootstrap;

import com.geoinsights.metacatalog.application.common.error.CatalogAdminException;
import com.geoinsights.metacatalog.application.common.error.ErrorCodes;
import com.geoinsights.metacatalog.config.CatalogProperties;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 레코드 테이블과 인덱스를 Flyway 마이그레이션으로 생성한다.
 *
 * <p>마이그레이션 SQL의 {@code ${table}} placeholder에 설정된 테이블명을 넣어 실행한다.
 * 위치는 {@code spring.flyway.locations}, 없으면 {@code classpath:db/migration/{방언}}을 사용한다.</p>
 *
 * <p>주요 설정값:
 * {@code spring.datasource.*}, {@code spring.flyway.locations},
 * {@code spring.flyway.baseline-on-migrate}, {@code spring.flyway.baseline-version}</p>
 */
@Component
public class SchemaProvisioner {

    private static final Logger log = LoggerFactory.getLogger(SchemaProvisioner.class);

    private final Environment env;
    private final CatalogProperties props;

    public SchemaProvisioner(Environment env, CatalogProperties props) {
        this.env = env;
        this.props = props;
    }

    /**
     * 마이그레이션을 실행한다.
     *
     * @return 적용된 마이그레이션 수
     * @throws CatalogAdminException 마이그레이션 실패 시
     */
    public int provision() {
        CatalogProperties.Repository repo = props.repository();
        String location = env.getProperty("spring.flyway.locations",
                "classpath:db/migration/" + repo.dialect().migrationDir());

        log.info("Provisioning table {} from {}", repo.table(), location);
        try {
            Flyway flyway = Flyway.configure()
                    .dataSource(
                            env.getProperty("spring.datasource.url"),
                            env.getProperty("spring.datasource.username"),
                            env.getProperty("spring.datasource.password"))
                    .locations(location)
                    .placeholders(Map.of("table", repo.table()))
                    .baselineOnMigrate(Boolean.parseBoolean(
                            env.getProperty("spring.flyway.baseline-on-migrate", "false")
                    ))
                    .baselineVersion(env.getProperty("spring.flyway.baseline-version", "0"))
                    .load();

            MigrateResult result = flyway.migrate();
            log.info("Applied {} migration(s) to {}", result.migrationsExecuted, repo.table());
            return result.migrationsExecuted;
        } catch (RuntimeException e) {
            throw new CatalogAdminException(
                    "ERROR: Database tables already exist: " + e.getMessage(),
                    ErrorCodes.PROVISION_FAILED, e);
        }
    }
}
