package com.raditha.unnest.workflow;

import com.raditha.unnest.model.ErrorKind;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.RegionOutcome;
import com.raditha.unnest.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Refactors many units in parallel on a bounded thread pool. Units share no mutable state.
 */
public class BatchRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(BatchRefactorer.class);

    private final NestingRefactorer refactorer;
    private final int threads;

    public BatchRefactorer(NestingRefactorer refactorer) {
        this(refactorer, Runtime.getRuntime().availableProcessors());
    }

    public BatchRefactorer(NestingRefactorer refactorer, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        this.refactorer = refactorer;
        this.threads = threads;
    }

    /**
     * Refactor units, returning their reports in input order.
     */
    public List<RefactoringReport> refactorAll(List<SourceUnit> units) {
        if (units.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, units.size()));
        try {
            List<Future<RefactoringReport>> futures = new ArrayList<>();
            for (SourceUnit unit : units) {
                futures.add(pool.submit(() -> refactorer.refactor(unit)));
            }
            List<RefactoringReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(futures.get(i), units.get(i)));
            }
            logger.info("Refactored {} units: {} regions applied", reports.size(),
                    reports.stream().mapToInt(r -> r.getApplied().size()).sum());
            return reports;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Read files and refactor them. The files themselves are left untouched.
     */
    public List<RefactoringReport> refactorFiles(List<Path> files) throws IOException {
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            units.add(SourceUnit.fromFile(file));
        }
        return refactorAll(units);
    }

    private RefactoringReport await(Future<RefactoringReport> future, SourceUnit unit) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Refactoring {} failed", unit.identity(), e.getCause());
            RegionOutcome failure = RegionOutcome.failed(null, null, ErrorKind.TRANSFORM_INFEASIBLE,
                    "unit processing failed: " + e.getCause().getMessage(), 0);
            return new RefactoringReport(unit, unit.text(), List.of(failure), 0, refactorer.getConfig());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while refactoring " + unit.identity(), e);
        }
    }
}
