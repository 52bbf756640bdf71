package com.example.prayer.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OffsetUpdateRequest {
    @NotNull(message = "minutes is required")
    @Min(value = -30, message = "offset must be at least -30 minutes")
    @Max(value = 30, message = "offset must be at most 30 minutes")
    private Integer minutes;
}
