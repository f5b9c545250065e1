package com.wpanther.greengoods.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedTask {

    private TaskType type;

    private String species;

    // Either a count (trees) or an amount with a unit (kg of weeds)
    private Integer count;

    private Integer amount;

    private String unit;

    public String summary() {
        if (count != null && count > 0) {
            return type.label() + ": " + count + " " + species;
        }
        if (amount != null && amount > 0) {
            return type.label() + ": " + amount + unit + " " + species;
        }
        return type.label() + ": " + species;
    }

    public int quantity() {
        if (count != null && count > 0) {
            return count;
        }
        return amount != null ? amount : 0;
    }
}
