package com.geojoin.joiner.batch;

import com.geojoin.joiner.config.JoinerProperties;
import com.geojoin.joiner.domain.JoinRunSummary;
import com.geojoin.joiner.service.BatchCoordinator;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the join once at startup. The exit code is non-zero when the run could not finish.
 */
@Component
public class JoinerJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(JoinerJobRunner.class);

    private final JoinerProperties properties;
    private final BatchCoordinator batchCoordinator;
    private JoinRunSummary lastRun;

    public JoinerJobRunner(JoinerProperties properties, BatchCoordinator batchCoordinator) {
        this.properties = properties;
        this.batchCoordinator = batchCoordinator;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info(
            "Joining {} register pages [{}, {}) of size {} to layer {} at {} using {}, concurrency {}, output {}",
            properties.getIndexBackend(),
            properties.getStartPage(),
            properties.getStopPage(),
            properties.getPageSize(),
            properties.getLayer(),
            properties.getWfsEndpoint(),
            properties.getPredicate(),
            properties.getConcurrency(),
            properties.getOutputFile()
        );
        lastRun = batchCoordinator.run();
        LOGGER.info(
            "Run {} {} in {}: pages={} skippedPages={} records={} resolved={} emptyMatches={} pointFailures={} pipFailures={} lastSequence={}",
            lastRun.getRunId(),
            lastRun.getStatus(),
            Duration.between(lastRun.getStartedAt(), lastRun.getCompletedAt()),
            lastRun.getPagesFetched(),
            lastRun.getPagesFailed(),
            lastRun.getDispatchedCount(),
            lastRun.getResolvedCount(),
            lastRun.getEmptyMatchCount(),
            lastRun.getPointFailedCount(),
            lastRun.getPipFailedCount(),
            lastRun.getLastSequenceNumber()
        );
    }

    @Override
    public int getExitCode() {
        return lastRun == null ? 1 : 0;
    }

    public JoinRunSummary getLastRun() {
        return lastRun;
    }
}
