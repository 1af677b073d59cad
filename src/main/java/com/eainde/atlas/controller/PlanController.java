package com.eainde.atlas.controller;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.execution.RunRecord;
import com.eainde.atlas.execution.RunRecordStore;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.workflow.AgentOrchestrator;
import com.eainde.atlas.workflow.PlanRequest;
import com.eainde.atlas.workflow.PlanResult;
import com.eainde.atlas.workflow.RunEventStream;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Executor;

/**
 * HTTP boundary of the agent: batch planning, Server-Sent Events streaming and run lookup.
 * <p>
 * Each streamed {@link RunEvent} becomes one SSE frame named after its type
 * (e.g. {@code tool-call-started}) with the event as JSON data.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
public class PlanController {

    private final AgentOrchestrator orchestrator;
    private final RunRecordStore runRecordStore;
    private final ObjectMapper objectMapper;
    private final Executor transportExecutor;
    private final AgentProperties properties;

    public PlanController(AgentOrchestrator orchestrator,
                          RunRecordStore runRecordStore,
                          ObjectMapper objectMapper,
                          @Qualifier("transportExecutor") Executor transportExecutor,
                          AgentProperties properties) {
        this.orchestrator = orchestrator;
        this.runRecordStore = runRecordStore;
        this.objectMapper = objectMapper;
        this.transportExecutor = transportExecutor;
        this.properties = properties;
    }

    @PostMapping("/plan")
    public PlanResult plan(@RequestBody PlanRequest request) {
        log.info("Plan request from user {}", request.userId());
        return orchestrator.run(request);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody PlanRequest request) {
        RunEventStream events = orchestrator.stream(request);
        log.info("Streaming run {} for user {}", events.runId(), request.userId());

        // Outlives the run deadline so that the terminal frame still goes out.
        SseEmitter emitter = new SseEmitter(properties.getRunTimeout().plusSeconds(30).toMillis());
        emitter.onCompletion(events::close);
        emitter.onTimeout(() -> {
            log.warn("SSE stream of run {} timed out", events.runId());
            events.close();
        });
        emitter.onError(error -> events.close());

        transportExecutor.execute(() -> forward(events, emitter));
        return emitter;
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<RunRecord> run(@PathVariable String id) {
        return runRecordStore.find(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private void forward(RunEventStream events, SseEmitter emitter) {
        try (events) {
            while (events.hasNext()) {
                RunEvent event = events.next();
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.sequence()))
                        .name(event.type().wireName())
                        .data(objectMapper.writeValueAsString(event)));
            }
            emitter.complete();
        } catch (IOException e) {
            log.info("Client of run {} went away: {}", events.runId(), e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Forwarding events of run {} failed", events.runId(), e);
            emitter.completeWithError(e);
        }
    }
}
