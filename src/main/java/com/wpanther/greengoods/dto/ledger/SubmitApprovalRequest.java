package com.wpanther.greengoods.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitApprovalRequest {

    @ToString.Exclude
    private String privateKey;

    private String gardenAddress;

    // Reference returned by the preceding work attestation
    private String workReference;

    private String gardenerAddress;

    private long actionId;

    private boolean approved;

    private String feedback;
}
