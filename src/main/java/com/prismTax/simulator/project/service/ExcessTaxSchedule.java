package com.prismTax.simulator.project.service;

import com.prismTax.simulator.config.SimulatorPolicyProperties;
import com.prismTax.simulator.config.SimulatorPolicyProperties.TaxBand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Progressive schedule applied to the unspent excess of a completed project.
 * Bands are consumed in order; a band without a width absorbs the remainder.
 */
@Component
@RequiredArgsConstructor
public class ExcessTaxSchedule {

    private final SimulatorPolicyProperties policy;

    /**
     * @param excess budget minus spent
     * @return tax due, zero when the excess is not positive
     */
    public BigDecimal taxOn(long excess) {
        if (excess <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal remaining = BigDecimal.valueOf(excess);
        BigDecimal tax = BigDecimal.ZERO;

        for (TaxBand band : policy.getExcessTaxBands()) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal taxable = band.getWidth() == null ? remaining : remaining.min(band.getWidth());
            tax = tax.add(taxable.multiply(band.getRate()));
            remaining = remaining.subtract(taxable);
        }
        return tax.setScale(2, RoundingMode.HALF_UP);
    }
}
