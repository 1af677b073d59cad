package com.eainde.atlas.workflow;

import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.execution.InMemoryRunRecordStore;
import com.eainde.atlas.execution.RunRecord;
import com.eainde.atlas.execution.RunStatus;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.run.RunEventType;
import com.eainde.atlas.support.AgentFixture;
import com.eainde.atlas.support.ScriptedReasoningModel;
import com.eainde.atlas.tools.builtin.FlightSearchTool;
import com.eainde.atlas.tools.builtin.WeatherTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class AgentOrchestratorStreamTest {

    private static final String ANSWER = "Day 1: Alfama\n- Castelo de Sao Jorge\nDay 2: Belem\n- Pasteis de Belem";

    private final List<AgentFixture> fixtures = new ArrayList<>();

    @AfterEach
    void tearDown() {
        fixtures.forEach(AgentFixture::close);
    }

    private AgentFixture agent(ScriptedReasoningModel model, int streamBuffer) {
        AgentFixture fixture = new AgentFixture(model,
                List.of(new WeatherTool(Clock.systemUTC()), new FlightSearchTool()),
                new InMemoryRunRecordStore(Clock.systemUTC()),
                p -> p.setStreamBuffer(streamBuffer));
        fixtures.add(fixture);
        return fixture;
    }

    private static ScriptedReasoningModel lisbonScript() {
        Map<String, Map<String, Object>> turn = new LinkedHashMap<>();
        turn.put("get_weather", Map.of("location", "Lisbon", "days", 2));
        turn.put("search_flights", Map.of("origin", "LHR", "destination", "LIS", "departure_date", "2026-07-10"));
        return new ScriptedReasoningModel().thenRequestAll(turn).thenAnswer(ANSWER);
    }

    // =========================================================================
    //  Completed streams
    // =========================================================================

    @Nested
    @DisplayName("stream() to a final answer")
    class CompletedStreams {

        @Test
        @DisplayName("deltas concatenate to the same answer the batch run returns")
        void streamMatchesBatch() throws Exception {
            PlanResult batch = agent(lisbonScript(), 16).orchestrator.run(PlanRequest.of("Lisbon, 2 days"));

            List<RunEvent> events;
            try (RunEventStream stream = agent(lisbonScript(), 16).orchestrator.stream(PlanRequest.of("Lisbon, 2 days"))) {
                events = stream.stream().toList();
            }

            String streamed = events.stream()
                    .filter(e -> e.type() == RunEventType.MESSAGE_DELTA)
                    .map(RunEvent::delta)
                    .collect(Collectors.joining());
            assertThat(streamed).isEqualTo(batch.answer());

            RunEvent last = events.get(events.size() - 1);
            assertThat(last.type()).isEqualTo(RunEventType.FINAL_RESULT);
            assertThat(last.result().answer()).isEqualTo(batch.answer());
            assertThat(last.result().toolInvocations()).hasSameSizeAs(batch.toolInvocations());
            assertThat(events).filteredOn(e -> e.type().isTerminal()).hasSize(1);
        }

        @Test
        @DisplayName("tool start and finish events are adjacent and sequences increase")
        void eventOrdering() {
            AgentFixture fixture = agent(lisbonScript(), 16);

            List<RunEvent> events;
            try (RunEventStream stream = fixture.orchestrator.stream(PlanRequest.of("Lisbon"))) {
                events = stream.stream().toList();
            }

            assertThat(events).extracting(RunEvent::sequence).isSorted().doesNotHaveDuplicates();
            assertThat(events.get(0).type()).isEqualTo(RunEventType.NODE_STARTED);
            assertThat(events.get(0).node()).isEqualTo("reasoning");
            for (int i = 0; i < events.size(); i++) {
                if (events.get(i).type() == RunEventType.TOOL_CALL_STARTED) {
                    RunEvent finished = events.get(i + 1);
                    assertThat(finished.type()).isEqualTo(RunEventType.TOOL_CALL_FINISHED);
                    assertThat(finished.toolInvocation().callId()).isEqualTo(events.get(i).toolCall().id());
                }
            }
            assertThat(events).filteredOn(e -> e.type() == RunEventType.TOOL_CALL_STARTED).hasSize(2);
            assertThat(fixture.store.find(events.get(0).runId()))
                    .hasValueSatisfying(r -> assertThat(r.status()).isEqualTo(RunStatus.COMPLETED));
        }
    }

    // =========================================================================
    //  Failures and cancellation
    // =========================================================================

    @Nested
    @DisplayName("stream() failures")
    class FailedStreams {

        @Test
        @DisplayName("a failed run ends with one ERROR event carrying the failure kind")
        void errorEvent() {
            ScriptedReasoningModel model = new ScriptedReasoningModel().then(history -> {
                throw new ReasoningUnavailableException("model offline");
            });

            List<RunEvent> events;
            try (RunEventStream stream = agent(model, 16).orchestrator.stream(PlanRequest.of("trip"))) {
                events = stream.stream().toList();
            }

            RunEvent last = events.get(events.size() - 1);
            assertThat(last.type()).isEqualTo(RunEventType.ERROR);
            assertThat(last.failureKind()).isEqualTo(FailureKind.REASONING_UNAVAILABLE);
            assertThat(last.error()).contains("model offline");
            assertThat(events).filteredOn(e -> e.type() == RunEventType.FINAL_RESULT).isEmpty();
        }

        @Test
        @DisplayName("closing after the first tool call cancels the run and records it as failed")
        void cancelAfterFirstToolCall() throws Exception {
            ScriptedReasoningModel model = new ScriptedReasoningModel()
                    .alwaysRequest("get_weather", Map.of("location", "Lisbon"));
            AgentFixture fixture = agent(model, 1);

            RunEventStream stream = fixture.orchestrator.stream(PlanRequest.of("trip"));
            RunEvent event;
            do {
                assertThat(stream.hasNext()).isTrue();
                event = stream.next();
            } while (event.type() != RunEventType.TOOL_CALL_STARTED);
            stream.close();

            assertThat(stream.awaitTermination(Duration.ofSeconds(10))).isTrue();
            assertThat(stream.hasNext()).isFalse();
            RunRecord record = fixture.store.find(stream.runId()).orElseThrow();
            assertThat(record.status()).isEqualTo(RunStatus.FAILED);
            assertThat(record.error()).contains("CANCELLED");
            assertThat(model.calls()).isLessThan(fixture.properties.getMaxIterations() + 1);
            assertThat(fixture.contexts.activeRunIds()).doesNotContain(stream.runId());
        }
    }
}
