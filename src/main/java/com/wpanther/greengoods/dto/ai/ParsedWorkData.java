package com.wpanther.greengoods.dto.ai;

import com.wpanther.greengoods.dto.SessionDraft;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured work extracted from a free-text or transcribed message.
 * Also the draft carried by the confirming_work step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedWorkData implements SessionDraft {

    @Builder.Default
    private List<ParsedTask> tasks = new ArrayList<>();

    private String notes;

    // ISO-8601 date (yyyy-MM-dd) the work was reported for
    private String date;

    @Override
    public boolean hasContent() {
        return tasks != null && !tasks.isEmpty();
    }
}
