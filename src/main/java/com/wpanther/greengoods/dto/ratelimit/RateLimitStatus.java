package com.wpanther.greengoods.dto.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {

    private int remaining;

    private int limit;
}
