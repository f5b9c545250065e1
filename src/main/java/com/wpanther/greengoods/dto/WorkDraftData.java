package com.wpanther.greengoods.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Work payload stored with a pending submission and sent to the ledger on approval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkDraftData {

    private long actionId;

    private String title;

    @Builder.Default
    private List<String> plantSelection = new ArrayList<>();

    private int plantCount;

    private String feedback;

    // References to uploaded media (object storage keys or URLs)
    @Builder.Default
    private List<String> media = new ArrayList<>();
}
