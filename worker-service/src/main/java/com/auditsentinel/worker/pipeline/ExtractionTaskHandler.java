package com.auditsentinel.worker.pipeline;

import com.auditsentinel.worker.scheduler.ProgressReporter;
import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskHandler;
import com.auditsentinel.worker.scheduler.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks an extraction through its stages. The collection itself runs in
 * the external extractor; this handler reports 10, 50 and 90 % with a fixed
 * pause after each stage and then completes.
 *
 * @since 1.0.0
 */
public class ExtractionTaskHandler implements TaskHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionTaskHandler.class);

    static final String COMPLETED_MESSAGE = "Extraction completed successfully";

    private final Duration stageDelay;

    public ExtractionTaskHandler(Duration stageDelay) {
        this.stageDelay = Objects.requireNonNull(stageDelay, "stageDelay must not be null");
        if (stageDelay.isNegative()) {
            throw new IllegalArgumentException("stageDelay must not be negative, got: " + stageDelay);
        }
    }

    @Override
    public TaskKind kind() {
        return TaskKind.EXTRACTION;
    }

    @Override
    public Map<String, Object> handle(Task task, ProgressReporter progress) throws InterruptedException {
        progress.report(10, "Starting extraction");
        pause();
        progress.report(50, "Extracting data");
        pause();
        progress.report(90, "Finalizing extraction");
        pause();
        LOG.info("Extraction task {} finished", task.getId());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", COMPLETED_MESSAGE);
        return result;
    }

    private void pause() throws InterruptedException {
        if (!stageDelay.isZero()) {
            Thread.sleep(stageDelay.toMillis());
        }
    }
}
