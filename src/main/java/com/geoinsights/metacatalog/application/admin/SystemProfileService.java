package com.geoinsights.metacatalog.application.admin;

import com.geoinsights.metacatalog.application.catalog.repository.CatalogRepository;
import com.geoinsights.metacatalog.application.catalog.repository.RecordFilter;
import com.geoinsights.metacatalog.config.CatalogProperties;
import io.r2dbc.spi.ConnectionFactory;
import org.flywaydb.core.Flyway;
import org.springframework.boot.SpringBootVersion;
import org.springframework.core.SpringVersion;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import tools.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * 실행 환경(Java, OS, 주요 라이브러리, DB) 정보를 사람이 읽을 수 있는 형태로 만든다.
 */
@Service
public class SystemProfileService {

    private final ConnectionFactory connectionFactory;
    private final ObjectMapper mapper;
    private final CatalogRepository repository;
    private final CatalogProperties props;

    public SystemProfileService(
            ConnectionFactory connectionFactory,
            ObjectMapper mapper,
            CatalogRepository repository,
            CatalogProperties props
    ) {
        this.connectionFactory = connectionFactory;
        this.mapper = mapper;
        this.repository = repository;
        this.props = props;
    }

    /**
     * @return 시스템 프로필 텍스트
     */
    public Mono<String> profile() {
        return repository.count(RecordFilter.all())
                .map(count -> String.join("\n",
                        "Java",
                        "  version: " + System.getProperty("java.version"),
                        "  vendor: " + System.getProperty("java.vendor"),
                        "OS",
                        "  name: " + System.getProperty("os.name"),
                        "  version: " + System.getProperty("os.version"),
                        "  arch: " + System.getProperty("os.arch"),
                        "Libraries",
                        "  Spring Boot: " + SpringBootVersion.getVersion(),
                        "  Spring Framework: " + SpringVersion.getVersion(),
                        "  Jackson: " + mapper.version(),
                        "  Flyway: " + Objects.toString(Flyway.class.getPackage().getImplementationVersion(), "unknown"),
                        "Database",
                        "  driver: " + connectionFactory.getMetadata().getName(),
                        "  dialect: " + props.repository().dialect(),
                        "  table: " + props.repository().table(),
                        "  records: " + count));
    }
}
