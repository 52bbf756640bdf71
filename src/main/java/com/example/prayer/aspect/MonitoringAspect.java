package com.example.prayer.aspect;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MeterRegistry meterRegistry;

    @Around("execution(public * com.example.prayer.service.PrayerScheduleCache.*(..))")
    public Object monitorScheduleCache(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "cache");
    }

    @Around("execution(public * com.example.prayer.service.NotificationOrchestrator.*(..))")
    public Object monitorOrchestrator(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "orchestrator");
    }

    @Around("execution(public * com.example.prayer.service.SettingsService.update*(..))"
            + " || execution(public * com.example.prayer.service.SettingsService.save(..))")
    public Object monitorSettingsUpdates(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "settings");
    }

    @Around("execution(public * com.example.prayer.service.CompletionTracker.*(..))")
    public Object monitorCompletionTracker(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "completion");
    }

    @Around("execution(* com.example.prayer.controller.*Controller.*(..))")
    public Object monitorController(ProceedingJoinPoint joinPoint) throws Throwable {
        return monitor(joinPoint, "controller");
    }

    private Object monitor(ProceedingJoinPoint joinPoint, String component) throws Throwable {
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String methodName = joinPoint.getSignature().getName();
        long startNanos = System.nanoTime();
        String status = "success";
        try {
            return joinPoint.proceed();
        } catch (Throwable e) {
            status = "error";
            log.error("{}.{} failed after {}ms: {}", className, methodName,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), e.getMessage());
            throw e;
        } finally {
            long duration = System.nanoTime() - startNanos;
            Timer.builder("prayer." + component + ".latency")
                    .tag("class", className)
                    .tag("method", methodName)
                    .tag("status", status)
                    .register(meterRegistry)
                    .record(duration, TimeUnit.NANOSECONDS);
            Counter.builder("prayer." + component + ".calls")
                    .tag("class", className)
                    .tag("method", methodName)
                    .tag("status", status)
                    .register(meterRegistry)
                    .increment();
            log.debug("{}.{} finished with {} in {}ms", className, methodName, status,
                    TimeUnit.NANOSECONDS.toMillis(duration));
        }
    }
}
