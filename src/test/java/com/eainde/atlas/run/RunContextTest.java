package com.eainde.atlas.run;

import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.error.RunCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {

    private static RunContext context(RunEventSink sink, Instant deadline) {
        return new RunContext(new RunState("run-1", null, null, "q"), sink, deadline);
    }

    @Test
    @DisplayName("events are numbered in emission order")
    void sequencesEvents() {
        List<RunEvent> received = new ArrayList<>();
        RunContext context = context(received::add, null);

        context.emit(RunEvent.nodeStarted("run-1", "reasoning"), RunEvent.messageDelta("run-1", "hi"));

        assertThat(received).extracting(RunEvent::sequence).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("cancel interrupts the bound worker and fails the next boundary check")
    void cancelInterruptsWorker() throws InterruptedException {
        RunContext context = context(RunEventSink.NOOP, null);
        Thread worker = new Thread(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();
        context.bindWorker(worker);

        context.cancel();
        worker.join(2_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(context.isCancelled()).isTrue();
        assertThatThrownBy(context::checkActive).isInstanceOf(RunCancelledException.class);
    }

    @Test
    @DisplayName("timeouts are shortened to the remaining deadline and fail once it has passed")
    void deadline() {
        RunContext soon = context(RunEventSink.NOOP, Instant.now().plusSeconds(2));
        RunContext passed = context(RunEventSink.NOOP, Instant.now().minusSeconds(1));

        assertThat(soon.boundedTimeout(Duration.ofMinutes(1))).isLessThanOrEqualTo(Duration.ofSeconds(2));
        assertThat(soon.boundedTimeout(Duration.ofMillis(100))).isEqualTo(Duration.ofMillis(100));
        assertThatThrownBy(() -> passed.boundedTimeout(Duration.ofMinutes(1)))
                .isInstanceOf(ReasoningUnavailableException.class);
        assertThatThrownBy(passed::checkActive).isInstanceOf(ReasoningUnavailableException.class);
    }

    @Test
    @DisplayName("quiet emission swallows a failing sink")
    void quietEmission() {
        RunContext context = context(event -> {
            throw new RunCancelledException("run-1");
        }, null);

        context.emitQuietly(RunEvent.error("run-1", FailureKind.INTERNAL, "x"));

        assertThatThrownBy(() -> context.emit(RunEvent.messageDelta("run-1", "x")))
                .isInstanceOf(RunCancelledException.class);
    }
}
