package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Change of one metric between two snapshots. {@code percent} has one decimal
 * and is 0 when the earlier value was 0.
 */
public record TrendDelta(double value, double percent, Direction direction) {

    public enum Direction {
        UP, DOWN, STABLE;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static TrendDelta between(double current, double previous) {
        double delta = current - previous;
        double percent = previous != 0 ? Math.round(delta / previous * 1000.0) / 10.0 : 0;
        Direction direction = delta > 0 ? Direction.UP : delta < 0 ? Direction.DOWN : Direction.STABLE;
        return new TrendDelta(delta, percent, direction);
    }
}
