package at.sv.prayer;

import at.sv.prayer.time.Location;
import lombok.Getter;

import java.util.Locale;

/**
 * Major Iranian cities with their coordinates.
 */
@Getter
public enum City {
    TEHRAN("تهران", 35.6892, 51.3890),
    TABRIZ("تبریز", 38.0800, 46.2919),
    MASHHAD("مشهد", 36.3264, 59.5433),
    ISFAHAN("اصفهان", 32.6525, 51.6746),
    SHIRAZ("شیراز", 29.5918, 52.5837),
    QOM("قم", 34.6401, 50.8764),
    AHVAZ("اهواز", 31.3203, 48.6692),
    KERMANSHAH("کرمانشاه", 34.3142, 47.0650),
    RASHT("رشت", 37.2808, 49.5831),
    YAZD("یزد", 31.8974, 54.3569);

    private static final String IRAN_TIME_ZONE = "Asia/Tehran";

    private final String persianName;
    private final double latitude;
    private final double longitude;
    private final String timeZone;

    City(String persianName, double latitude, double longitude) {
        this.persianName = persianName;
        this.latitude = latitude;
        this.longitude = longitude;
        this.timeZone = IRAN_TIME_ZONE;
    }

    /**
     * @return the English name, e.g. {@code Kermanshah}
     */
    public String getDisplayName() {
        String lower = name().toLowerCase(Locale.ENGLISH);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    public Location toLocation() {
        return new Location(latitude, longitude, timeZone);
    }

    /**
     * Looks up a city by its English or Persian name, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if no city matches
     */
    public static City fromName(String name) {
        String trimmed = name == null ? "" : name.trim();
        for (City city : values()) {
            if (city.name().equalsIgnoreCase(trimmed) || city.persianName.equals(trimmed)) {
                return city;
            }
        }
        throw new IllegalArgumentException("Unknown city: '" + name + "'");
    }
}
