package io.netnotes.fastscroll.utils;

import java.text.SimpleDateFormat;
import java.util.Date;

public class TimeHelpers {

    /**
     * Format timestamp for log file names
     */
    public static String formatDate(long timestamp) {
        return new SimpleDateFormat("yyyy-MM-dd").format(new Date(timestamp));
    }

    public static String formatTime(long timestamp) {
        return new SimpleDateFormat("HH:mm:ss.SSS").format(new Date(timestamp));
    }
}
