package com.eainde.atlas.format;

import java.util.List;

/**
 * Structured view of a final answer.
 *
 * @param days  day sections in answer order
 * @param notes lines outside any day section
 */
public record Itinerary(List<DayPlan> days, List<String> notes) {

    public Itinerary {
        days = List.copyOf(days);
        notes = List.copyOf(notes);
    }

    public static Itinerary empty() {
        return new Itinerary(List.of(), List.of());
    }

    public boolean isEmpty() {
        return days.isEmpty() && notes.isEmpty();
    }
}
