package com.wpanther.greengoods.port;

import com.wpanther.greengoods.dto.ledger.GardenInfo;
import com.wpanther.greengoods.dto.ledger.SubmitApprovalRequest;
import com.wpanther.greengoods.dto.ledger.SubmitWorkRequest;
import com.wpanther.greengoods.dto.ledger.VerificationResult;

/**
 * Client of the external attestation ledger. Implementations bound their own call timeouts
 * and report failures as {@link com.wpanther.greengoods.exception.LedgerException}.
 */
public interface LedgerPort {

    /**
     * @return reference (transaction hash) of the work attestation
     */
    String submitWork(SubmitWorkRequest request);

    String submitApproval(SubmitApprovalRequest request);

    /**
     * Whether {@link #submitApproval} records a separate approval attestation.
     */
    default boolean supportsApprovalAttestation() {
        return false;
    }

    VerificationResult isOperator(String gardenAddress, String userAddress);

    VerificationResult isGardener(String gardenAddress, String userAddress);

    GardenInfo getGardenInfo(String gardenAddress);

    long getChainId();

    void clearCache();
}
