package com.rev.saas.engine.service.scenario;

import com.rev.saas.engine.model.DeltaRange;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the free-text metric ranges found on scenarios.
 * Hyphen, en dash and minus sign are all accepted as range separators.
 */
public final class MetricRanges {

    private static final Pattern PERCENT_RANGE = Pattern.compile("([+-]?\\d+\\.?\\d*)[–\\-−](\\d+\\.?\\d*)");
    private static final Pattern PERCENT_SINGLE = Pattern.compile("([+-]?\\d+\\.?\\d*)");
    private static final Pattern DAY_RANGE = Pattern.compile("(\\d+)[–\\-−](\\d+)");
    private static final Pattern DAY_SINGLE = Pattern.compile("(\\d+)");

    private static final DeltaRange ZERO = new DeltaRange(0, 0);

    private MetricRanges() {
    }

    /**
     * "+15-25%" gives (15, 25), "+15%" gives (15, 15); blank, "Stagnates" and "N/A" give (0, 0).
     */
    public static DeltaRange percentRange(String text) {
        if (isNone(text)) return ZERO;
        String s = text.trim();
        Matcher m = PERCENT_RANGE.matcher(s);
        if (m.find()) {
            return new DeltaRange(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)));
        }
        Matcher single = PERCENT_SINGLE.matcher(s);
        if (single.find()) {
            double v = Double.parseDouble(single.group(1));
            return new DeltaRange(v, v);
        }
        return ZERO;
    }

    /**
     * "30-60 days" gives (30, 60), "45 days" gives (45, 45); anything unparseable gives (0, 0).
     */
    public static DeltaRange dayRange(String text) {
        if (isNone(text)) return ZERO;
        String s = text.trim();
        Matcher m = DAY_RANGE.matcher(s);
        if (m.find()) {
            return new DeltaRange(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)));
        }
        Matcher single = DAY_SINGLE.matcher(s);
        if (single.find()) {
            double v = Double.parseDouble(single.group(1));
            return new DeltaRange(v, v);
        }
        return ZERO;
    }

    public static double midpoint(DeltaRange range) {
        return (range.getMin() + range.getMax()) / 2d;
    }

    /**
     * Whole-day midpoint of the time-to-impact range, or {@code fallback} when it cannot be parsed or does not
     * fit a positive int.
     */
    public static int horizonDays(String timeToImpact, int fallback) {
        double mid = Math.floor(midpoint(dayRange(timeToImpact)));
        if (mid < 1 || mid > Integer.MAX_VALUE) return fallback;
        return (int) mid;
    }

    private static boolean isNone(String text) {
        if (text == null || text.isBlank()) return true;
        String lower = text.trim().toLowerCase(Locale.ROOT);
        return lower.equals("stagnates") || lower.equals("n/a");
    }
}
