package com.wpanther.greengoods.dto.ledger;

import com.wpanther.greengoods.dto.WorkDraftData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitWorkRequest {

    // Signing key of the account that submits the attestation
    @ToString.Exclude
    private String privateKey;

    private String gardenAddress;

    private String gardenerAddress;

    private WorkDraftData data;
}
