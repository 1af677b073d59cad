package com.eainde.atlas.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs of the agent workflow, bound from {@code atlas.agent.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "atlas.agent")
public class AgentProperties {

    /**
     * Reasoning/tool cycles allowed before a run fails.
     */
    private int maxIterations = 10;

    private Duration reasoningTimeout = Duration.ofSeconds(60);

    /**
     * Per tool call.
     */
    private Duration toolTimeout = Duration.ofSeconds(30);

    /**
     * Default deadline of a run when the request carries none.
     */
    private Duration runTimeout = Duration.ofMinutes(5);

    /**
     * Events buffered between a streaming run and its consumer.
     */
    private int streamBuffer = 16;

    private int toolPoolSize = 8;

    private int runPoolSize = 8;

    /**
     * RUNNING records untouched for this long are swept to FAILED.
     */
    private Duration staleRunAfter = Duration.ofMinutes(30);

    private String systemPrompt = """
            You are a travel planning assistant. Use the available tools to look up weather, \
            flights, hotels and guide information before answering. When you have enough \
            information, answer with a day-by-day itinerary using "Day N:" headings.""";
}
