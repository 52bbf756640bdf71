package com.example.prayer.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToggleRequest {
    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
