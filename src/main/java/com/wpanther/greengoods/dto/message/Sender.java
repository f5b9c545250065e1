package com.wpanther.greengoods.dto.message;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sender {

    @NotBlank(message = "Sender platformId is required")
    private String platformId;

    private String displayName;
}
