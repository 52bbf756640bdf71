package com.example.prayer.dto;

import com.example.prayer.model.PrayerId;
import com.example.prayer.util.Constants.CompletionResult;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

@Data
@AllArgsConstructor
public class CompletionResponse {
    private final PrayerId prayer;
    private final LocalDate date;
    private final CompletionResult result;
}
