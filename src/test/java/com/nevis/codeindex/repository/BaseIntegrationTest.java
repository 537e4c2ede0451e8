package com.nevis.codeindex.repository;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(properties = {
    "app.gemini.api-key=fake-key-value-for-testing",
    "app.indexing.workspace-dir=${java.io.tmpdir}/code-index-it"
})
@Testcontainers
public abstract class BaseIntegrationTest {

    static final int DIMENSION = 768;

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("pgvector/pgvector:pg16");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.hikari.initialization-fail-timeout", () -> "0");
    }

    static float[] unitVector(int axis) {
        float[] vector = new float[DIMENSION];
        vector[axis] = 1f;
        return vector;
    }
}
