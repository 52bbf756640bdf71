package com.example.prayer.service.notification;

import com.example.prayer.model.ReminderId;
import com.example.prayer.util.Constants.SoundCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReminderRequest {
    ReminderId id;
    String title;
    String body;
    Instant fireAt;
    SoundCategory soundCategory;
    String soundFile;
}
