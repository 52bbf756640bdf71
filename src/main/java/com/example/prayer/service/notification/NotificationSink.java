package com.example.prayer.service.notification;

import com.example.prayer.model.ReminderId;
import com.example.prayer.util.Constants.PermissionStatus;
import reactor.core.publisher.Flux;

import java.util.Set;

/**
 * Local reminder scheduling on the device. Scheduling an id that is already pending
 * replaces the pending reminder.
 */
public interface NotificationSink {

    void schedule(ReminderRequest request);

    void cancel(ReminderId id);

    void cancelAll(Set<ReminderId> ids);

    /**
     * Emits the current permission status on subscription and every change after that.
     */
    Flux<PermissionStatus> permissionStatus();
}
