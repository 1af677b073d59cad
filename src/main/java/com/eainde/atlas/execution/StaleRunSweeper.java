package com.eainde.atlas.execution;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.error.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Marks runs whose orchestrating task died without a final write as FAILED, so that no
 * record stays RUNNING indefinitely.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleRunSweeper {

    static final String STALE_MESSAGE = "Run abandoned: no progress recorded";

    private final RunRecordStore runRecordStore;
    private final AgentProperties properties;

    @Scheduled(fixedDelayString = "${atlas.agent.stale-sweep-interval:PT5M}")
    public void sweepStaleRuns() {
        int swept = sweep();
        if (swept > 0) {
            log.info("Stale run sweep marked {} run(s) as FAILED", swept);
        }
    }

    public int sweep() {
        List<RunRecord> stale;
        try {
            stale = runRecordStore.findStale(properties.getStaleRunAfter());
        } catch (PersistenceException e) {
            log.warn("Stale run sweep skipped: {}", e.getMessage());
            return 0;
        }
        int swept = 0;
        for (RunRecord record : stale) {
            try {
                runRecordStore.complete(record.id(), RunStatus.FAILED, null, STALE_MESSAGE);
                swept++;
                log.warn("Marked stale run {} (last update {}) as FAILED", record.id(), record.updatedAt());
            } catch (PersistenceException e) {
                log.error("Could not mark stale run {} as FAILED", record.id(), e);
            }
        }
        return swept;
    }
}
