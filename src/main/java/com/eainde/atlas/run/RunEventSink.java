package com.eainde.atlas.run;

/**
 * Receives the events of one run as the graph advances.
 */
@FunctionalInterface
public interface RunEventSink {

    RunEventSink NOOP = event -> {
    };

    /**
     * May block until the consumer has room for the event.
     *
     * @throws com.eainde.atlas.error.RunCancelledException when the consumer went away
     */
    void emit(RunEvent event);
}
