package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.ledger.VerificationResult;
import com.wpanther.greengoods.port.LedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Operator role check that fails closed: errors and missing answers both deny.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OperatorVerifier {

    private final LedgerPort ledgerPort;

    public VerificationResult verify(String gardenAddress, String userAddress) {
        VerificationResult result;
        try {
            result = ledgerPort.isOperator(gardenAddress, userAddress);
        } catch (Exception e) {
            log.error("Operator verification failed: garden={}, user={}", gardenAddress, userAddress, e);
            return VerificationResult.denied("Verification failed: " + e.getMessage());
        }

        if (result == null) {
            return VerificationResult.denied("Verification returned no result");
        }
        if (!result.isVerified()) {
            log.warn("Operator permission denied: garden={}, user={}, reason={}",
                    gardenAddress, userAddress, result.getReason());
            if (result.getReason() == null) {
                return VerificationResult.denied("Address is not an operator for this garden");
            }
        }
        return result;
    }
}
