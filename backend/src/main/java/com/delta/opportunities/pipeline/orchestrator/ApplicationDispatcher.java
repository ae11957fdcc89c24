package com.delta.opportunities.pipeline.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongConsumer;

/**
 * Runs orchestration steps on the worker pool with at most one step per application at a time.
 * A dispatch that arrives while the application's step is running is folded into a single
 * re-run once that step finishes.
 */
public class ApplicationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ApplicationDispatcher.class);

    private final Executor executor;
    private final LongConsumer step;
    // present = running; value true = another run was requested meanwhile
    private final Map<Long, Boolean> running = new ConcurrentHashMap<>();

    public ApplicationDispatcher(Executor executor, LongConsumer step) {
        this.executor = executor;
        this.step = step;
    }

    public void dispatch(long applicationId) {
        boolean[] start = {false};
        running.compute(applicationId, (id, rerun) -> {
            if (rerun == null) {
                start[0] = true;
                return Boolean.FALSE;
            }
            return Boolean.TRUE;
        });
        if (start[0]) {
            submit(applicationId);
        }
    }

    public int inFlight() {
        return running.size();
    }

    private void submit(long applicationId) {
        try {
            executor.execute(() -> run(applicationId));
        } catch (RejectedExecutionException e) {
            running.remove(applicationId);
            log.warn("Dispatch of application {} rejected; it will be resumed on the next sweep or restart", applicationId, e);
        }
    }

    private void run(long applicationId) {
        try {
            step.accept(applicationId);
        } catch (Exception e) {
            log.warn("Orchestration step failed for application {}", applicationId, e);
        } finally {
            boolean[] again = {false};
            running.compute(applicationId, (id, rerun) -> {
                if (Boolean.TRUE.equals(rerun)) {
                    again[0] = true;
                    return Boolean.FALSE;
                }
                return null;
            });
            if (again[0]) {
                submit(applicationId);
            }
        }
    }
}
