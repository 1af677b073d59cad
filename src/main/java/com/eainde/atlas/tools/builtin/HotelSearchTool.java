package com.eainde.atlas.tools.builtin;

import com.eainde.atlas.tools.AbstractToolCapability;
import com.eainde.atlas.tools.FieldType;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.tools.ToolSchema;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hotel availability in a city for a stay. Fixture data keyed on the city name.
 */
@Component
public class HotelSearchTool extends AbstractToolCapability {

    public static final String NAME = "hotel_search";

    private static final String[][] CATEGORIES = {
            {"budget", "Hostel", "60"},
            {"mid-range", "Boutique Hotel", "140"},
            {"luxury", "Grand Palace", "380"}
    };

    public HotelSearchTool() {
        super(NAME,
                "Search for hotels in a location. Useful for travel planning and booking.",
                ToolSchema.builder()
                        .required("city", FieldType.STRING, "City to search in")
                        .required("country", FieldType.STRING, "Country of the city")
                        .required("check_in_date", FieldType.STRING, "Check-in date in YYYY-MM-DD format")
                        .required("check_out_date", FieldType.STRING, "Check-out date in YYYY-MM-DD format")
                        .optional("adults", FieldType.INTEGER, "Number of adult guests", 1)
                        .build());
    }

    @Override
    protected ToolResult invoke(Map<String, Object> arguments) {
        String city = stringArg(arguments, "city");
        String country = stringArg(arguments, "country");
        int adults = intArg(arguments, "adults");
        LocalDate checkIn;
        LocalDate checkOut;
        try {
            checkIn = LocalDate.parse(stringArg(arguments, "check_in_date"));
            checkOut = LocalDate.parse(stringArg(arguments, "check_out_date"));
        } catch (DateTimeParseException e) {
            return ToolResult.failure("dates must be YYYY-MM-DD: " + e.getParsedString());
        }
        long nights = ChronoUnit.DAYS.between(checkIn, checkOut);
        if (nights <= 0) {
            return ToolResult.failure("check_out_date must be after check_in_date");
        }
        if (adults < 1) {
            return ToolResult.failure("adults must be at least 1");
        }

        List<Map<String, Object>> hotels = new ArrayList<>();
        for (String[] category : CATEGORIES) {
            double nightly = Double.parseDouble(category[2]) * (adults > 2 ? 1.5 : 1.0);
            Map<String, Object> hotel = new LinkedHashMap<>();
            hotel.put("name", city + " " + category[1]);
            hotel.put("category", category[0]);
            hotel.put("city", city);
            hotel.put("country", country);
            hotel.put("price_per_night_usd", nightly);
            hotel.put("total_price_usd", nightly * nights);
            hotels.add(hotel);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("city", city);
        payload.put("nights", nights);
        payload.put("adults", adults);
        payload.put("hotels", hotels);

        return ToolResult.success(payload, List.of(new SourceAttribution(
                "hotels:" + city,
                hotels.size() + " hotels in " + city + " for " + nights + " nights")));
    }
}
