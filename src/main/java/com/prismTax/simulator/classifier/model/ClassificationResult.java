package com.prismTax.simulator.classifier.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClassificationResult {

    private Intent intent;

    /**
     * Present only when the classifier ran the artificial-transaction check.
     */
    private ArtificialTransactionCheck artificialTransactionCheck;

    public boolean isSuspicious() {
        return artificialTransactionCheck != null && artificialTransactionCheck.isSuspicious();
    }
}
