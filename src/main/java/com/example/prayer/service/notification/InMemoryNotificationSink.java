package com.example.prayer.service.notification;

import com.example.prayer.model.ReminderId;
import com.example.prayer.util.Constants.PermissionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps pending reminders in memory and logs every change. Stands in for the platform
 * notification scheduler when the service runs headless.
 */
@Service
@Slf4j
public class InMemoryNotificationSink implements NotificationSink, PermissionStatusReporter {

    private final Map<ReminderId, ReminderRequest> pending = new ConcurrentHashMap<>();
    private final Sinks.Many<PermissionStatus> permissionSink = Sinks.many().replay().latest();

    public InMemoryNotificationSink() {
        permissionSink.tryEmitNext(PermissionStatus.NOT_DETERMINED);
    }

    @Override
    public void schedule(ReminderRequest request) {
        pending.put(request.getId(), request);
        log.info("Reminder {} scheduled at {}: '{}'", request.getId(), request.getFireAt(), request.getTitle());
    }

    @Override
    public void cancel(ReminderId id) {
        if (pending.remove(id) != null) {
            log.info("Reminder {} cancelled", id);
        }
    }

    @Override
    public void cancelAll(Set<ReminderId> ids) {
        ids.forEach(pending::remove);
        log.info("Cancelled reminders {}", ids);
    }

    @Override
    public Flux<PermissionStatus> permissionStatus() {
        return permissionSink.asFlux();
    }

    @Override
    public synchronized void updatePermissionStatus(PermissionStatus status) {
        log.info("Notification permission changed to {}", status);
        permissionSink.tryEmitNext(status);
    }

    public Optional<ReminderRequest> pendingReminder(ReminderId id) {
        return Optional.ofNullable(pending.get(id));
    }

    public Map<ReminderId, ReminderRequest> pendingReminders() {
        return Map.copyOf(pending);
    }
}
