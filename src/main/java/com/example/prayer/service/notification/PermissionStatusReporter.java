package com.example.prayer.service.notification;

import com.example.prayer.util.Constants.PermissionStatus;

/**
 * Entry point for the device reporting a change in notification permission. Implementations
 * publish the new status on {@link NotificationSink#permissionStatus()}.
 */
public interface PermissionStatusReporter {

    void updatePermissionStatus(PermissionStatus status);
}
