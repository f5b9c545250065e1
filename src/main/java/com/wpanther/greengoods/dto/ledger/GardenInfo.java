package com.wpanther.greengoods.dto.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GardenInfo {

    private boolean exists;

    private String name;

    private String address;

    public static GardenInfo notFound(String address) {
        return new GardenInfo(false, null, address);
    }
}
