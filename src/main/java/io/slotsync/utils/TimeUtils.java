package io.slotsync.utils;

import java.time.Duration;

public class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Formats a duration as {@code HH:mm:ss}, prefixed with the number of days when there are any.
     * Negative durations get a leading minus sign.
     */
    public static String formatDuration(Duration duration) {
        String sign = duration.isNegative() ? "-" : "";
        Duration d = duration.abs();
        long days = d.toDays();
        String time = String.format("%02d:%02d:%02d", d.toHoursPart(), d.toMinutesPart(), d.toSecondsPart());
        return days > 0 ? sign + days + "d " + time : sign + time;
    }
}
