package com.supporters.application.config;

import com.supporters.domain.payment.Cadence;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportSettingsTest {

    @Test
    void defaults() {
        ReportSettings s = ReportSettings.from(new MapConfig());

        assertThat(s.format()).isEqualTo(ReportSettings.ReportFormat.CSV);
        assertThat(s.cadences()).containsExactlyInAnyOrder(Cadence.ANNUAL, Cadence.MONTHLY);
    }

    @Test
    void readsConfiguredValues() {
        ReportSettings s = ReportSettings.from(new MapConfig()
                .with("report.format", " JSON ")
                .with("report.cadences", "monthly"));

        assertThat(s.format()).isEqualTo(ReportSettings.ReportFormat.JSON);
        assertThat(s.cadences()).containsExactly(Cadence.MONTHLY);
    }

    @Test
    void rejectsUnknownValues() {
        assertThatThrownBy(() -> ReportSettings.parseFormat("pdf"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("csv or json");
        assertThatThrownBy(() -> ReportSettings.parseCadences("Annual,Quarterly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Quarterly");
    }
}
