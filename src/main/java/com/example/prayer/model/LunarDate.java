package com.example.prayer.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Hijri calendar date paired with a day of prayer times.
 */
@Value
@Builder
@Jacksonized
public class LunarDate {
    int day;
    int month;
    int year;
    String monthName;
}
