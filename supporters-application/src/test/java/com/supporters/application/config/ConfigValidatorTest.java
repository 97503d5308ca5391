package com.supporters.application.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    private final ConfigValidator validator = new ConfigValidator();

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new MapConfig()).ok()).isTrue();
    }

    @Test
    void reportsEveryProblem() {
        MapConfig cfg = new MapConfig()
                .with("db.url", "jdbc:postgresql://localhost/x")
                .with("report.format", "xml")
                .with("report.cadences", "Annual,Weekly")
                .with("log.level", "LOUD");

        ConfigValidationResult res = validator.validate(cfg);

        assertThat(res.ok()).isFalse();
        assertThat(res.errors()).hasSize(4);
        assertThat(res.errors()).anySatisfy(e -> assertThat(e).startsWith("db.url"));
        assertThat(res.errors()).anySatisfy(e -> assertThat(e).contains("Weekly"));
    }

    @Test
    void emptyCadenceListIsAnError() {
        ConfigValidationResult res = validator.validate(new MapConfig().with("report.cadences", " , "));

        assertThat(res.errors()).singleElement().asString().contains("report.cadences is empty");
    }
}
