package com.tonindexer.ingestion.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.StandardEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = IngestionConfig.class, properties = {
        "tonindexer.ingestion.batch-size=25",
        "tonindexer.ingestion.max-attempts=3"
})
class IngestionPropertiesTest {

    @Autowired
    IngestionProperties properties;

    @Test
    void binds_overrides_andKeepsDefaults() {
        assertThat(properties.getBatchSize()).isEqualTo(25);
        assertThat(properties.getMaxAttempts()).isEqualTo(3);
        assertThat(properties.getScheduleIntervalMs()).isEqualTo(60_000);
    }

    @Test
    void schedulePlaceholder_defaultMatchesBoundDefault() {
        String resolved = new StandardEnvironment().resolvePlaceholders(IngestionProperties.SCHEDULE_INTERVAL_PLACEHOLDER);

        assertThat(resolved).isEqualTo(String.valueOf(new IngestionProperties().getScheduleIntervalMs()));
    }
}
