package at.sv.prayer.time;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The times of a {@link PrayerTimeSet}, in chronological order.
 */
@Getter
@RequiredArgsConstructor
public enum Prayer {
    FAJR("Fajr"),
    SUNRISE("Sunrise"),
    DHUHR("Dhuhr"),
    ASR("Asr"),
    SUNSET("Sunset"),
    MAGHRIB("Maghrib"),
    ISHA("Isha"),
    MIDNIGHT("Midnight");

    private final String displayName;
}
