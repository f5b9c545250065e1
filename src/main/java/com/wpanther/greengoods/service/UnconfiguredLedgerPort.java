package com.wpanther.greengoods.service;

import com.wpanther.greengoods.dto.ledger.GardenInfo;
import com.wpanther.greengoods.dto.ledger.SubmitApprovalRequest;
import com.wpanther.greengoods.dto.ledger.SubmitWorkRequest;
import com.wpanther.greengoods.dto.ledger.VerificationResult;
import com.wpanther.greengoods.exception.LedgerException;
import com.wpanther.greengoods.port.LedgerPort;
import lombok.extern.slf4j.Slf4j;

/**
 * Ledger stand-in for deployments without a ledger client. Fails closed on every call:
 * no role is ever verified, no garden exists and nothing can be attested.
 */
@Slf4j
public class UnconfiguredLedgerPort implements LedgerPort {

    static final String NOT_CONFIGURED = "Ledger client is not configured";

    @Override
    public String submitWork(SubmitWorkRequest request) {
        throw new LedgerException(NOT_CONFIGURED);
    }

    @Override
    public String submitApproval(SubmitApprovalRequest request) {
        throw new LedgerException(NOT_CONFIGURED);
    }

    @Override
    public VerificationResult isOperator(String gardenAddress, String userAddress) {
        log.warn("Operator check denied, ledger not configured: garden={}, user={}", gardenAddress, userAddress);
        return VerificationResult.denied(NOT_CONFIGURED);
    }

    @Override
    public VerificationResult isGardener(String gardenAddress, String userAddress) {
        return VerificationResult.denied(NOT_CONFIGURED);
    }

    @Override
    public GardenInfo getGardenInfo(String gardenAddress) {
        return GardenInfo.notFound(gardenAddress);
    }

    @Override
    public long getChainId() {
        throw new LedgerException(NOT_CONFIGURED);
    }

    @Override
    public void clearCache() {
        // nothing cached
    }
}
