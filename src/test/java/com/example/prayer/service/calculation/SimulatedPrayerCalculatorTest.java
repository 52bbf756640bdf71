package com.example.prayer.service.calculation;

import com.example.prayer.config.AppProperties;
import com.example.prayer.exception.PrayerDataException;
import com.example.prayer.model.DailyTimes;
import com.example.prayer.model.LunarDate;
import com.example.prayer.model.PrayerId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimulatedPrayerCalculator")
class SimulatedPrayerCalculatorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 15);

    private final AppProperties appProperties = new AppProperties();
    private final SimulatedPrayerCalculator calculator = new SimulatedPrayerCalculator(appProperties);

    @Test
    @DisplayName("Configured wall-clock times are placed on the requested date")
    void configuredTimes() {
        DailyTimes times = calculator.compute(DATE, 21.42, 39.83, "Auto", "hanafi");

        assertThat(times.getDate()).isEqualTo(DATE);
        assertThat(times.timeOf(PrayerId.FAJR)).contains(Instant.parse("2024-03-15T05:00:00Z"));
        assertThat(times.timeOf(PrayerId.ISHA)).contains(Instant.parse("2024-03-15T19:50:00Z"));
        assertThat(times.getTimes()).hasSize(6);
    }

    @Test
    @DisplayName("Lunar date is attached from the Hijri calendar")
    void lunarDate() {
        LunarDate lunar = calculator.compute(DATE, 21.42, 39.83, "Auto", "hanafi").getLunarDate();

        assertThat(lunar).isNotNull();
        assertThat(lunar.getYear()).isEqualTo(1445);
        assertThat(lunar.getMonth()).isEqualTo(9);
        assertThat(lunar.getMonthName()).isEqualTo("Ramadan");
    }

    @Test
    @DisplayName("A blank configured time leaves that slot empty")
    void blankSlotIsEmpty() {
        appProperties.getCalculator().getSimulatedTimes().put(PrayerId.ISHA, "");

        assertThat(calculator.compute(DATE, 64.1, -21.9, "Auto", "hanafi").timeOf(PrayerId.ISHA)).isEmpty();
    }

    @Test
    @DisplayName("Invalid coordinates or configuration raise PrayerDataException")
    void invalidInput() {
        assertThatThrownBy(() -> calculator.compute(DATE, 95, 0, "Auto", "hanafi"))
                .isInstanceOf(PrayerDataException.class);

        appProperties.getCalculator().getSimulatedTimes().put(PrayerId.FAJR, "25:99");
        assertThatThrownBy(() -> calculator.compute(DATE, 21.42, 39.83, "Auto", "hanafi"))
                .isInstanceOf(PrayerDataException.class);
    }
}
