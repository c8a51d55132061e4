package com.geoinsights.metacatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 메타데이터 카탈로그 관리 애플리케이션 진입점.
 *
 * <p>웹 서버 없이 구동되며, {@code admin} 프로필에서 관리 명령(적재/내보내기/하베스트 갱신 등)을 실행한 뒤 종료한다.</p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MetaCatalogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MetaCatalogApplication.class, args)));
    }
}
