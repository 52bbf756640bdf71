package com.example.prayer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One calendar day of prayer times. A slot may be missing when the calculator could not
 * produce it (e.g. high latitudes); every query below treats missing slots as absent
 * rather than failing.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DailyTimes {

    private final LocalDate date;
    private final Map<PrayerId, Instant> times;
    private final LunarDate lunarDate;

    @JsonCreator
    public DailyTimes(@JsonProperty("date") LocalDate date,
                      @JsonProperty("times") Map<PrayerId, Instant> times,
                      @JsonProperty("lunarDate") LunarDate lunarDate) {
        this.date = Objects.requireNonNull(date, "date");
        EnumMap<PrayerId, Instant> slots = new EnumMap<>(PrayerId.class);
        if (times != null) {
            times.forEach((prayer, time) -> {
                if (prayer != null && time != null) {
                    slots.put(prayer, time);
                }
            });
        }
        this.times = Collections.unmodifiableMap(slots);
        this.lunarDate = lunarDate;
    }

    public Optional<Instant> timeOf(PrayerId prayer) {
        return Optional.ofNullable(times.get(prayer));
    }

    public boolean hasAnySlot() {
        return !times.isEmpty();
    }

    /**
     * Shifts each slot by the given number of minutes. Prayers without an entry keep their time.
     */
    public DailyTimes withOffsets(Map<PrayerId, Integer> offsetMinutes) {
        if (offsetMinutes == null || offsetMinutes.isEmpty()) {
            return this;
        }
        EnumMap<PrayerId, Instant> shifted = new EnumMap<>(PrayerId.class);
        times.forEach((prayer, time) -> {
            Integer offset = offsetMinutes.get(prayer);
            shifted.put(prayer, offset == null ? time : time.plus(Duration.ofMinutes(offset)));
        });
        return new DailyTimes(date, shifted, lunarDate);
    }

    /**
     * The last prayer whose time has been reached, or empty before the first slot of the day.
     */
    public Optional<PrayerId> currentPrayer(Instant now) {
        PrayerId current = null;
        for (PrayerId prayer : PrayerId.values()) {
            Instant time = times.get(prayer);
            if (time != null && !time.isAfter(now)) {
                current = prayer;
            }
        }
        return Optional.ofNullable(current);
    }

    /**
     * The first slot strictly after {@code now}. Once every slot has passed, today's first
     * available slot shifted by one day stands in for tomorrow's.
     */
    public UpcomingPrayer nextPrayer(Instant now) {
        return nextPrayer(now, null);
    }

    /**
     * The first slot strictly after {@code now}. Once every slot has passed, the first slot of
     * {@code following} is used; when that day is unknown or empty, today's first slot shifted
     * by one day stands in for it.
     */
    public UpcomingPrayer nextPrayer(Instant now, DailyTimes following) {
        for (PrayerId prayer : PrayerId.values()) {
            Instant time = times.get(prayer);
            if (time != null && time.isAfter(now)) {
                return new UpcomingPrayer(prayer, time, false);
            }
        }
        Optional<PrayerId> first = firstSlot();
        if (first.isEmpty()) {
            return UpcomingPrayer.unavailable();
        }
        if (following != null) {
            Optional<PrayerId> tomorrowFirst = following.firstSlot();
            if (tomorrowFirst.isPresent()) {
                return new UpcomingPrayer(tomorrowFirst.get(), following.times.get(tomorrowFirst.get()), true);
            }
        }
        return new UpcomingPrayer(first.get(), times.get(first.get()).plus(Duration.ofDays(1)), true);
    }

    /**
     * True once every available slot of the day has passed.
     */
    public boolean allPassed(Instant now) {
        return hasAnySlot() && times.values().stream().noneMatch(time -> time.isAfter(now));
    }

    private Optional<PrayerId> firstSlot() {
        for (PrayerId prayer : PrayerId.values()) {
            if (times.containsKey(prayer)) {
                return Optional.of(prayer);
            }
        }
        return Optional.empty();
    }
}
