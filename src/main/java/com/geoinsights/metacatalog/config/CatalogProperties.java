package com.geoinsights.metacatalog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * {@code catalog.*} 설정 바인딩.
 *
 * @param repository 레코드 저장소(테이블/DB 방언) 설정
 * @param server     카탈로그 서비스 공개 URL 설정
 * @param harvest    원격 하베스트 요청 설정
 */
@Validated
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
        @Valid @NotNull Repository repository,
        @Valid @NotNull Server server,
        @Valid @NotNull Harvest harvest
) {

    /**
     * 레코드 테이블 설정.
     *
     * <p>테이블명은 SQL에 직접 삽입되므로 식별자 패턴으로 제한한다.</p>
     *
     * @param table   레코드 테이블명
     * @param dialect DB 방언(마이그레이션 위치, 유지보수 구문 선택)
     */
    public record Repository(
            @NotBlank @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*") String table,
            @NotNull Dialect dialect
    ) {}

    /**
     * @param url 카탈로그 서비스 엔드포인트(sitemap, 기본 하베스트 대상)
     */
    public record Server(@NotBlank String url) {}

    /**
     * @param timeout 원격 하베스트 요청 타임아웃
     */
    public record Harvest(@NotNull Duration timeout) {}

    /** 지원 DB 방언 */
    public enum Dialect {
        MYSQL,
        H2;

        /** Flyway 마이그레이션 디렉터리명 */
        public String migrationDir() {
            return name().toLowerCase();
        }
    }
}
