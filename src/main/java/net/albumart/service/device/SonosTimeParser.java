package net.albumart.service.device;

/**
 * Parses the {@code H:MM:SS} and {@code M:SS} durations reported by Sonos players.
 */
final class SonosTimeParser {

    private SonosTimeParser() {
    }

    /**
     * @return milliseconds, or 0 for blank, {@code NOT_IMPLEMENTED} and malformed values
     */
    static long toMillis(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        String[] parts = value.trim().split(":");
        try {
            if (parts.length == 3) {
                return (Long.parseLong(parts[0]) * 3600 + Long.parseLong(parts[1]) * 60 + parseSeconds(parts[2])) * 1000;
            }
            if (parts.length == 2) {
                return (Long.parseLong(parts[0]) * 60 + parseSeconds(parts[1])) * 1000;
            }
        } catch (NumberFormatException e) {
            return 0L;
        }
        return 0L;
    }

    // Some firmware appends fractional seconds ("0:03:25.000")
    private static long parseSeconds(String value) {
        int dot = value.indexOf('.');
        return Long.parseLong(dot >= 0 ? value.substring(0, dot) : value);
    }
}
