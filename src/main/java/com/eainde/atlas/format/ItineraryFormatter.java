package com.eainde.atlas.format;

/**
 * Turns the final answer text of a run into the structured itinerary returned to callers.
 */
public interface ItineraryFormatter {

    Itinerary format(String answer);
}
