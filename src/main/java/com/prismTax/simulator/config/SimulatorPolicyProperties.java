package com.prismTax.simulator.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code simulator.policy} section from application.yaml.
 *
 * These are the thresholds the simulator applies locally. The remote tax
 * calculators own the authoritative values; keep both in sync when rates change.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "simulator.policy")
public class SimulatorPolicyProperties {

    /** Exact digit count of a National Identification Number. */
    private int ninLength = 11;

    /** Minimum digit count of a Tax Identification Number. */
    private int tinMinLength = 10;

    /** Credits strictly above this amount are treated as sales and queued for review. */
    private BigDecimal largeTransactionThreshold = new BigDecimal("500000");

    /** Cash or labour expenses at or above this amount raise an advisory. */
    private long largeCashExpenseThreshold = 500_000L;

    private BigDecimal vatRate = new BigDecimal("0.075");

    /** Flat withholding applied to rental income. */
    private BigDecimal rentalWithholdingRate = new BigDecimal("0.10");

    /** Monthly earnings at or below this amount are exempt from PAYE. */
    private long minimumMonthlyWage = 70_000L;

    /** Number of (role, text) turns forwarded to the classifier as context. */
    private int conversationWindowSize = 5;

    /** Progressive schedule applied to the unspent excess of a completed project. */
    private List<TaxBand> excessTaxBands = new ArrayList<>(List.of(
            new TaxBand(new BigDecimal("800000"), BigDecimal.ZERO),
            new TaxBand(null, new BigDecimal("0.15"))
    ));

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaxBand {
        /** Width of the band; null means the band is unbounded. */
        private BigDecimal width;
        private BigDecimal rate;
    }
}
