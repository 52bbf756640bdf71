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
public class RemembranceUpdateRequest {
    @NotNull(message = "enabled is required")
    private Boolean enabled;

    @Min(value = 1, message = "intervalHours must be at least 1")
    @Max(value = 24, message = "intervalHours must be at most 24")
    private Integer intervalHours;
}
