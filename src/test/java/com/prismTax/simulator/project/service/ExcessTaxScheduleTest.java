package com.prismTax.simulator.project.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExcessTaxScheduleTest {

    private final ExcessTaxSchedule schedule = new ExcessTaxSchedule(new SimulatorPolicyProperties());

    @Test
    void noTaxWithinFirstBand() {
        assertThat(schedule.taxOn(300_000)).isEqualByComparingTo("0");
        assertThat(schedule.taxOn(800_000)).isEqualByComparingTo("0");
    }

    @Test
    void remainderTaxedAtFifteenPercent() {
        assertThat(schedule.taxOn(1_800_000)).isEqualByComparingTo("150000");
    }

    @Test
    void nonPositiveExcessIsNotTaxed() {
        assertThat(schedule.taxOn(0)).isEqualByComparingTo("0");
        assertThat(schedule.taxOn(-250_000)).isEqualByComparingTo("0");
    }
}
