package com.giftcard.fraudguard.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ReplayThreatsRequestDto {

    /** Most recent fraud logs to replay; null uses the configured default. */
    @Min(1)
    @Max(500)
    private Integer limit;
}
