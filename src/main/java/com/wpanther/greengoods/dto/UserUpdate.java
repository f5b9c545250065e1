package com.wpanther.greengoods.dto;

import com.wpanther.greengoods.entity.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mutable user fields. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdate {

    private String currentGarden;

    private UserRole role;
}
