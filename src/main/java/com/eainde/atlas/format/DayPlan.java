package com.eainde.atlas.format;

import java.util.List;

/**
 * @param title text after the "Day N" heading, may be empty
 * @param lines entries under the heading, bullet markers removed
 */
public record DayPlan(int day, String title, List<String> lines) {

    public DayPlan {
        lines = List.copyOf(lines);
    }
}
