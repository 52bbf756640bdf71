package com.example.prayer.dto;

import com.example.prayer.model.LunarDate;
import com.example.prayer.model.PrayerId;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
public class TodayTimesResponse {
    private final LocalDate date;
    private final LunarDate lunarDate;
    private final Map<PrayerId, Instant> times;
    private final Map<PrayerId, Instant> adjustedTimes;
}
