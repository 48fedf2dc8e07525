package com.example.reconcile.config;

import com.example.reconcile.model.Resolution;
import com.example.reconcile.model.ReviewDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(ReviewConfig.class)
            .withBean(ReviewProperties.class, ReviewProperties::defaults)
            .withPropertyValues(
                    "spring.jackson.property-naming-strategy=SNAKE_CASE",
                    "spring.jackson.serialization.write-dates-as-timestamps=false");

    @Test
    @DisplayName("the shared ObjectMapper honours spring.jackson settings")
    void objectMapperUsesJacksonProperties() {
        runner.run(context -> {
            ObjectMapper mapper = context.getBean(ObjectMapper.class);

            assertThat(mapper.writeValueAsString(new ReviewDecision("NRM-001", Resolution.ACCEPTED, null)))
                    .contains("\"issue_id\":\"NRM-001\"")
                    .contains("\"resolution\":\"accepted\"");
            assertThat(mapper.writeValueAsString(Instant.parse("2024-05-02T09:00:00Z")))
                    .isEqualTo("\"2024-05-02T09:00:00Z\"");
            assertThat(mapper.readValue("{\"issue_id\":\"NRM-001\",\"resolution\":\"deferred\",\"note\":\"later\"}",
                    ReviewDecision.class).resolution()).isEqualTo(Resolution.DEFERRED);
        });
    }

    @Test
    void sharedBeansAreRegistered() {
        runner.run(context -> assertThat(context).hasBean("reviewExecutor").hasBean("reviewClock"));
    }
}
