package com.cos.race_prevention;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * 통합 테스트 공통 DB - Testcontainers PostgreSQL 16
 *
 * H2가 아닌 실제 PostgreSQL에서 행 락 / UPDATE 재평가 동작을 검증함.
 * 컨테이너는 JVM당 한 번만 띄우고 모든 Spring 컨텍스트가 공유
 * (컨텍스트 캐시가 테스트 클래스보다 오래 살아남으므로 클래스 단위 @Container를 쓰지 않음)
 */
public abstract class PostgresIntegrationTest {

    protected static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                    .withDatabaseName("race_condition_test")
                    .withUsername("postgres")
                    .withPassword("password");

    static {
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }
}
