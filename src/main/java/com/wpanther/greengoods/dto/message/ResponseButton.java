package com.wpanther.greengoods.dto.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseButton {

    private String label;

    private String callbackData;

    private String url;

    public static ResponseButton callback(String label, String callbackData) {
        return ResponseButton.builder().label(label).callbackData(callbackData).build();
    }
}
