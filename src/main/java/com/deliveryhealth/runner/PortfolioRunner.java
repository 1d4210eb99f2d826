package com.deliveryhealth.runner;

import com.deliveryhealth.config.ThresholdConfig;
import com.deliveryhealth.model.ScoreRecord;
import com.deliveryhealth.model.ScoringResult;
import com.deliveryhealth.model.WeeklySnapshot;
import com.deliveryhealth.scoring.HealthScoringEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scores a portfolio with one task per project on a fixed thread pool. Results come back in the
 * order projects first appear in the input.
 */
public final class PortfolioRunner {
    private static final Logger LOG = LogManager.getLogger(PortfolioRunner.class);

    private final HealthScoringEngine engine;
    private final int threads;

    public PortfolioRunner(HealthScoringEngine engine, int threads) {
        this.engine = engine;
        this.threads = Math.max(1, threads);
    }

    public ScoringResult run(List<WeeklySnapshot> snapshots, ThresholdConfig thresholds) throws InterruptedException {
        Map<String, List<WeeklySnapshot>> groups = HealthScoringEngine.groupByProject(snapshots);
        int poolSize = Math.min(threads, groups.size());
        if (poolSize <= 1) {
            return engine.score(snapshots, thresholds);
        }

        long startedNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<ProjectOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<ProjectOutcome>, String> submitted = new HashMap<>();
        for (Map.Entry<String, List<WeeklySnapshot>> entry : groups.entrySet()) {
            submitted.put(completion.submit(new ProjectTask(entry.getKey(), entry.getValue(), thresholds)), entry.getKey());
        }

        Map<String, ProjectOutcome> outcomes = new HashMap<>();
        try {
            for (int i = 0; i < submitted.size(); i++) {
                Future<ProjectOutcome> future = completion.take();
                String projectId = submitted.get(future);
                try {
                    outcomes.put(projectId, future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("project task failed project_id={} err={}", projectId, cause.toString(), cause);
                    outcomes.put(projectId, ProjectOutcome.failed(cause.toString()));
                }
            }
        } catch (InterruptedException e) {
            List<Runnable> pending = pool.shutdownNow();
            LOG.warn("portfolio scoring interrupted completed={} pending={}", outcomes.size(), pending.size());
            throw e;
        } finally {
            pool.shutdown();
        }

        Map<String, List<ScoreRecord>> series = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String projectId : groups.keySet()) {
            ProjectOutcome outcome = outcomes.get(projectId);
            if (outcome.error == null) {
                series.put(projectId, outcome.records);
            } else {
                failures.put(projectId, outcome.error);
            }
        }
        LOG.info("portfolio scored projects={} failed={} threads={} elapsed_ms={}",
                series.size(), failures.size(), poolSize, (System.nanoTime() - startedNanos) / 1_000_000L);
        return new ScoringResult(series, failures);
    }

    private final class ProjectTask implements Callable<ProjectOutcome> {
        private final String projectId;
        private final List<WeeklySnapshot> rows;
        private final ThresholdConfig thresholds;

        private ProjectTask(String projectId, List<WeeklySnapshot> rows, ThresholdConfig thresholds) {
            this.projectId = projectId;
            this.rows = rows;
            this.thresholds = thresholds;
        }

        @Override
        public ProjectOutcome call() {
            try {
                return new ProjectOutcome(engine.scoreProject(projectId, rows, thresholds), null);
            } catch (RuntimeException e) {
                LOG.error("project scoring failed project_id={} rows={} err={}", projectId, rows.size(), e.toString(), e);
                return ProjectOutcome.failed(e.getClass().getSimpleName()
                        + (e.getMessage() == null ? "" : ": " + e.getMessage()));
            }
        }
    }

    private static final class ProjectOutcome {
        final List<ScoreRecord> records;
        final String error;

        ProjectOutcome(List<ScoreRecord> records, String error) {
            this.records = records;
            this.error = error;
        }

        static ProjectOutcome failed(String error) {
            return new ProjectOutcome(List.of(), error == null ? "unknown error" : error);
        }
    }
}
