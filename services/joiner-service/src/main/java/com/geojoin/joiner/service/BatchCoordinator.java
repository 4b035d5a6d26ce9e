package com.geojoin.joiner.service;

import com.geojoin.joiner.client.FetchIdBatchException;
import com.geojoin.joiner.client.IdentifierPager;
import com.geojoin.joiner.client.ResultSink;
import com.geojoin.joiner.domain.IdentifierPage;
import com.geojoin.joiner.domain.JoinRunSummary;
import com.geojoin.joiner.domain.OutputRecord;
import com.geojoin.joiner.domain.ResolutionOutcome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one joiner run: pages through the register, resolves each page in groups of at most
 * {@code concurrency} identifiers and appends every completed group to the sink before the next
 * group is dispatched.
 * <p>
 * Pages are requested from {@code startPage} up to, but excluding, {@code stopPage}. The loop also
 * ends after a page that reports no further pages. A page that cannot be fetched is logged and
 * skipped; the page index advances regardless.
 */
public class BatchCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);

    private final IdentifierPager pager;
    private final RecordResolver resolver;
    private final ResultSink sink;
    private final Executor executor;
    private final int startPage;
    private final int stopPage;
    private final int pageSize;
    private final int concurrency;
    private final long sequenceStart;

    public BatchCoordinator(
        IdentifierPager pager,
        RecordResolver resolver,
        ResultSink sink,
        Executor executor,
        int startPage,
        int stopPage,
        int pageSize,
        int concurrency,
        long sequenceStart
    ) {
        if (startPage < 1) {
            throw new IllegalArgumentException("startPage must be >= 1: " + startPage);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1: " + concurrency);
        }
        this.pager = pager;
        this.resolver = resolver;
        this.sink = sink;
        this.executor = executor;
        this.startPage = startPage;
        this.stopPage = stopPage;
        this.pageSize = pageSize;
        this.concurrency = concurrency;
        this.sequenceStart = sequenceStart;
    }

    public JoinRunSummary run() {
        JoinRunSummary run = JoinRunSummary.startNew();
        long nextSequence = sequenceStart;
        int pageIndex = startPage;
        boolean hasMore = true;
        try {
            while (pageIndex < stopPage && hasMore) {
                try {
                    IdentifierPage page = pager.fetchPage(pageIndex, pageSize);
                    run.incrementPagesFetched();
                    LOGGER.info("Page {}: {} identifiers, more={}", pageIndex, page.identifiers().size(), page.hasMore());
                    nextSequence = processPage(page.identifiers(), nextSequence, run);
                    hasMore = page.hasMore();
                } catch (FetchIdBatchException ex) {
                    run.incrementPagesFailed();
                    LOGGER.error("Skipping page {}: {}", pageIndex, ex.getMessage(), ex);
                }
                pageIndex++;
            }
            run.complete();
            return run;
        } catch (RuntimeException fatal) {
            run.fail(fatal.getMessage() == null ? fatal.getClass().getName() : fatal.getMessage());
            LOGGER.error("Run {} aborted at page {}: {}", run.getRunId(), pageIndex, run.getErrorSummary(), fatal);
            throw fatal;
        }
    }

    private long processPage(List<String> identifiers, long nextSequence, JoinRunSummary run) {
        int indexer = 0;
        while (indexer < identifiers.size()) {
            int width = Math.min(concurrency, identifiers.size() - indexer);
            List<CompletableFuture<ResolutionOutcome>> tasks = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                long sequenceNumber = nextSequence++;
                String identifier = identifiers.get(indexer++);
                tasks.add(CompletableFuture.supplyAsync(() -> resolver.resolve(sequenceNumber, identifier), executor));
            }

            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

            List<ResolutionOutcome> outcomes = tasks.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparingLong(ResolutionOutcome::sequenceNumber))
                .toList();
            sink.flush(outcomes.stream().map(OutputRecord::from).toList());
            outcomes.forEach(run::record);
        }
        return nextSequence;
    }
}
