package com.example.prayer.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class CompletionRecord {
    PrayerId prayerId;
    LocalDate date;
    boolean completed;
}
