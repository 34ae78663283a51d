package com.openforge.meetingmemory.query;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * How far back a query looks. Defaults to {@link #RECENT}.
 */
public enum TemporalScope {

    RECENT(Duration.ofDays(14)),
    LAST_WEEK(Duration.ofDays(7)),
    LAST_MONTH(Duration.ofDays(30)),
    ALL_TIME(null);

    private static final Pattern LAST_WEEK_RULE  = Pattern.compile("\\b(?:last|this|past) week\\b");
    private static final Pattern LAST_MONTH_RULE = Pattern.compile("\\b(?:last|this|past) month\\b");
    private static final Pattern ALL_TIME_RULE   =
            Pattern.compile("\\bever\\b|\\ball time\\b|\\boriginally\\b|\\bhistory\\b|\\bfrom the start\\b");

    private final Duration window;

    TemporalScope(Duration window) {
        this.window = window;
    }

    /** Look-back window, or null for no limit. */
    @Nullable
    public Duration window() {
        return window;
    }

    public static TemporalScope detect(String query) {
        if (query == null) return RECENT;
        String q = query.toLowerCase(Locale.ROOT);
        if (LAST_WEEK_RULE.matcher(q).find()) return LAST_WEEK;
        if (LAST_MONTH_RULE.matcher(q).find()) return LAST_MONTH;
        if (ALL_TIME_RULE.matcher(q).find()) return ALL_TIME;
        return RECENT;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
