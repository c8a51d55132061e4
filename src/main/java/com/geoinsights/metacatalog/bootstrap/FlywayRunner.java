package com.geoinsights.metacatalog.bootstrap;

import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;

/**
 * 애플리케이션 시작 시점에 레코드 테이블 마이그레이션을 실행하는 설정 클래스입니다.
 *
 * <p>{@code local}, {@code test} 프로필에서만 활성화되며,
 * 운영 환경에서는 {@code setup-db} 명령으로 명시적으로 실행한다.</p>
 */
@Configuration
@Profile({"local", "test"})
public class FlywayRunner {

    /**
     * 컨텍스트 초기화 직후 {@link SchemaProvisioner#provision()}을 수행하는 Runner Bean을 생성합니다.
     *
     * @param provisioner 스키마 생성기
     * @return 마이그레이션을 수행하는 {@link ApplicationRunner}
     */
    @Bean
    @Order(0)
    ApplicationRunner runFlyway(SchemaProvisioner provisioner) {
        return args -> provisioner.provision();
    }
}
