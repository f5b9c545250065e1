package com.wpanther.greengoods.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a role membership check. Anything other than verified=true is a denial.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    private boolean verified;

    private String reason;

    // Epoch millis of the cached answer, when the ledger client served one
    private Long cachedAt;

    public static VerificationResult verified() {
        return VerificationResult.builder().verified(true).build();
    }

    public static VerificationResult denied(String reason) {
        return VerificationResult.builder().verified(false).reason(reason).build();
    }
}
