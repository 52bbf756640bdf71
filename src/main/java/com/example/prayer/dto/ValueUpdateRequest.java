package com.example.prayer.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValueUpdateRequest {
    @NotBlank(message = "value must not be blank")
    private String value;
}
