package com.wpanther.greengoods.dto;

import com.wpanther.greengoods.entity.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserRequest {

    private Platform platform;

    private String platformId;

    // Plaintext; encrypted by the storage adapter before it is persisted
    @ToString.Exclude
    private String privateKey;

    private String address;
}
