package com.eainde.atlas.tools.builtin;

import com.eainde.atlas.tools.AbstractToolCapability;
import com.eainde.atlas.tools.FieldType;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.tools.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weather forecast for a location. Returns deterministic fixture data shaped like a real
 * forecast API response.
 */
@Slf4j
@Component
public class WeatherTool extends AbstractToolCapability {

    public static final String NAME = "get_weather";

    static final int MAX_DAYS = 10;
    private static final String[] CONDITIONS = {"Sunny", "Partly cloudy", "Cloudy", "Light rain"};

    private final Clock clock;

    public WeatherTool(Clock clock) {
        super(NAME,
                "Get current weather and forecast for a location. Useful for travel planning.",
                ToolSchema.builder()
                        .required("location", FieldType.STRING, "Location to get weather for (city, country)")
                        .optional("days", FieldType.INTEGER, "Number of days to forecast (1-10)", 7)
                        .build());
        this.clock = clock;
    }

    @Override
    protected ToolResult invoke(Map<String, Object> arguments) {
        String location = stringArg(arguments, "location");
        int days = intArg(arguments, "days");
        if (days < 1 || days > MAX_DAYS) {
            return ToolResult.failure("days must be between 1 and " + MAX_DAYS + " but was " + days);
        }

        LocalDate today = LocalDate.now(clock);
        List<Map<String, Object>> forecast = new ArrayList<>();
        for (int day = 0; day < days; day++) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("day", day + 1);
            entry.put("date", today.plusDays(day).toString());
            entry.put("high", 25 + (day % 5));
            entry.put("low", 15 + (day % 3));
            entry.put("condition", CONDITIONS[day % CONDITIONS.length]);
            entry.put("precipitation_chance", Math.min(20 + day * 10, 80));
            forecast.add(entry);
        }

        Map<String, Object> current = new LinkedHashMap<>();
        current.put("temperature", 22);
        current.put("condition", "Partly cloudy");
        current.put("humidity", 65);
        current.put("wind_speed", 10);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("location", location);
        payload.put("current", current);
        payload.put("forecast", forecast);

        log.debug("Weather forecast prepared for {} ({} days)", location, days);
        return ToolResult.success(payload, List.of(new SourceAttribution(
                "weather:" + location,
                days + "-day forecast for " + location + ": " + forecast.get(0).get("condition")
                        + ", " + forecast.get(0).get("low") + "-" + forecast.get(0).get("high") + "°C")));
    }
}
