package com.kafcat.app.config;

import com.kafcat.core.error.ConfigurationException;
import com.kafcat.core.model.KafkaOffset;

import java.util.Locale;

/**
 * Parses the textual offset forms accepted on the command line.
 * <pre>
 * beginning | end | stored      symbolic positions
 * 42 | -1                       absolute, or relative to the tail when negative
 * 10..20 | 10..                 offset interval, open end when omitted
 * s@1700000000000[..&lt;end&gt;]     time interval in epoch millis
 * </pre>
 */
public final class OffsetParser {
    private static final String TIME_PREFIX = "s@";
    private static final String RANGE = "..";

    private OffsetParser() {
    }

    public static KafkaOffset parse(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        try {
            switch (value) {
                case "beginning":
                    return KafkaOffset.beginning();
                case "end":
                    return KafkaOffset.end();
                case "stored":
                    return KafkaOffset.stored();
                default:
                    break;
            }

            if (value.startsWith(TIME_PREFIX)) {
                String range = value.substring(TIME_PREFIX.length());
                return KafkaOffset.timeInterval(begin(range), end(range));
            }
            if (value.contains(RANGE)) {
                return KafkaOffset.offsetInterval(begin(value), end(value));
            }
            return KafkaOffset.offset(Long.parseLong(value));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new ConfigurationException("Invalid offset '" + text + "': " + e.getMessage(), e);
        }
    }

    private static long begin(String range) {
        int separator = range.indexOf(RANGE);
        return Long.parseLong(separator < 0 ? range : range.substring(0, separator));
    }

    private static long end(String range) {
        int separator = range.indexOf(RANGE);
        if (separator < 0) {
            return KafkaOffset.OPEN_END;
        }
        String end = range.substring(separator + RANGE.length());
        return end.isEmpty() ? KafkaOffset.OPEN_END : Long.parseLong(end);
    }
}
