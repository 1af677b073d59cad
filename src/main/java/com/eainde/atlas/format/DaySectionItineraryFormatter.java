package com.eainde.atlas.format;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an answer into day sections on headings such as {@code Day 1: Alfama},
 * {@code ## Day 2 - Belem} or {@code **Day 3**}. Lines before the first heading become notes.
 */
@Slf4j
@Component
public class DaySectionItineraryFormatter implements ItineraryFormatter {

    private static final Pattern DAY_HEADING = Pattern.compile(
            "^\\s*(?:#+\\s*)?(?:\\*\\*)?day\\s+(\\d+)(?:\\*\\*)?\\s*[:.\\-–]?\\s*(.*?)\\s*(?:\\*\\*)?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+");

    @Override
    public Itinerary format(String answer) {
        if (answer == null || answer.isBlank()) {
            return Itinerary.empty();
        }

        List<DayPlan> days = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        Integer currentDay = null;
        String currentTitle = null;
        List<String> currentLines = new ArrayList<>();

        for (String raw : answer.split("\\R")) {
            if (raw.isBlank()) {
                continue;
            }
            Matcher heading = DAY_HEADING.matcher(raw);
            if (heading.matches()) {
                if (currentDay != null) {
                    days.add(new DayPlan(currentDay, currentTitle, currentLines));
                }
                currentDay = Integer.parseInt(heading.group(1));
                currentTitle = heading.group(2).replace("**", "").trim();
                currentLines = new ArrayList<>();
                continue;
            }
            String line = BULLET.matcher(raw).replaceFirst("").trim();
            if (currentDay == null) {
                notes.add(line);
            } else {
                currentLines.add(line);
            }
        }
        if (currentDay != null) {
            days.add(new DayPlan(currentDay, currentTitle, currentLines));
        }

        log.debug("Formatted answer into {} day section(s) and {} note(s)", days.size(), notes.size());
        return new Itinerary(days, notes);
    }
}
