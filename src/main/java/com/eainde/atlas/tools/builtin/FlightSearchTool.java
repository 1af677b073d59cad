package com.eainde.atlas.tools.builtin;

import com.eainde.atlas.tools.AbstractToolCapability;
import com.eainde.atlas.tools.FieldType;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.tools.ToolSchema;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flight offers between two airports on a given date. Fixture data derived from the
 * route so the same search always yields the same offers.
 */
@Component
public class FlightSearchTool extends AbstractToolCapability {

    public static final String NAME = "search_flights";

    private static final String[] CARRIERS = {"TP", "BA", "LH", "AF", "IB"};

    public FlightSearchTool() {
        super(NAME,
                "Search for flights between two locations. Useful for travel planning and booking.",
                ToolSchema.builder()
                        .required("origin", FieldType.STRING, "IATA code of the departure airport")
                        .required("destination", FieldType.STRING, "IATA code of the arrival airport")
                        .required("departure_date", FieldType.STRING, "Departure date in YYYY-MM-DD format")
                        .build());
    }

    @Override
    protected ToolResult invoke(Map<String, Object> arguments) {
        String origin = stringArg(arguments, "origin").toUpperCase(Locale.ROOT);
        String destination = stringArg(arguments, "destination").toUpperCase(Locale.ROOT);
        String departureDate = stringArg(arguments, "departure_date");
        try {
            LocalDate.parse(departureDate);
        } catch (DateTimeParseException e) {
            return ToolResult.failure("departure_date must be YYYY-MM-DD but was '" + departureDate + "'");
        }
        if (origin.equals(destination)) {
            return ToolResult.failure("origin and destination must differ");
        }

        int seed = Math.abs((origin + destination + departureDate).hashCode());
        List<Map<String, Object>> flights = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String carrier = CARRIERS[(seed + i) % CARRIERS.length];
            int departureHour = 6 + ((seed / (i + 1)) % 14);
            int durationMinutes = 90 + ((seed + i * 37) % 240);
            Map<String, Object> flight = new LinkedHashMap<>();
            flight.put("flight_number", carrier + (100 + (seed + i * 53) % 900));
            flight.put("airline", carrier);
            flight.put("origin", origin);
            flight.put("destination", destination);
            flight.put("departure_date", departureDate);
            flight.put("departure_time", String.format(Locale.ROOT, "%02d:%02d", departureHour, (i * 20) % 60));
            flight.put("duration_minutes", durationMinutes);
            flight.put("price_usd", 120.0 + ((seed + i * 97) % 600));
            flight.put("stops", durationMinutes > 240 ? 1 : 0);
            flights.add(flight);
        }
        flights.sort(Comparator.comparingDouble(f -> (Double) f.get("price_usd")));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("search_params", Map.of(
                "origin", origin, "destination", destination, "departure_date", departureDate));
        payload.put("outbound_flights", flights);
        payload.put("cheapest_price_usd", flights.get(0).get("price_usd"));

        return ToolResult.success(payload, List.of(new SourceAttribution(
                "flights:" + origin + "-" + destination,
                flights.size() + " offers from " + origin + " to " + destination + " on " + departureDate
                        + ", from $" + flights.get(0).get("price_usd"))));
    }
}
