package com.project.omr.service;

import com.project.omr.DTOs.AnswerKey;
import com.project.omr.DTOs.BatchSummary;
import com.project.omr.DTOs.EvaluationResult;
import com.project.omr.exceptions.EmptyAnswerKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class BatchEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(BatchEvaluationService.class);

    private final OmrDetector detector;
    private final int workers;

    public BatchEvaluationService(OmrDetector detector) {
        this.detector = detector;
        this.workers = detector.properties().batch().effectiveWorkers();
    }

    public BatchSummary evaluateAll(List<Path> sheets, AnswerKey answerKey) {
        return evaluateAll(sheets, answerKey, detector.properties().expectedOptions());
    }

    public BatchSummary evaluateAll(List<Path> sheets, AnswerKey answerKey, int expectedOptions) {
        if (answerKey == null || answerKey.size() == 0) {
            throw new EmptyAnswerKeyException();
        }

        log.info("Evaluating {} sheets with {} workers", sheets.size(), workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<CompletableFuture<EvaluationResult>> futures = new ArrayList<>(sheets.size());
            for (Path sheet : sheets) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> detector.evaluate(sheet, answerKey, expectedOptions), pool)
                        .exceptionally(e -> {
                            log.error("Unexpected failure on {}", sheet, e);
                            return EvaluationResult.error("Unexpected failure: " + e.getMessage());
                        }));
            }

            List<BatchSummary.SheetOutcome> outcomes = new ArrayList<>(sheets.size());
            int succeeded = 0;
            double percentageSum = 0.0;
            for (int i = 0; i < sheets.size(); i++) {
                Path sheet = sheets.get(i);
                EvaluationResult result = futures.get(i).join();
                outcomes.add(new BatchSummary.SheetOutcome(sheet.getFileName().toString(), result));

                if (result.isSuccess()) {
                    succeeded++;
                    percentageSum += result.percentage();
                    log.info("{}: {}/{} ({}%)", sheet.getFileName(), result.score(), result.total(), result.percentage());
                } else {
                    log.warn("{}: {}", sheet.getFileName(), result.error());
                }
            }

            double average = succeeded == 0 ? 0.0 : Evaluator.round2(percentageSum / succeeded);
            log.info("Batch finished: {} succeeded, {} failed, average {}%",
                    succeeded, sheets.size() - succeeded, average);
            return new BatchSummary(List.copyOf(outcomes), succeeded, sheets.size() - succeeded, average);
        } finally {
            pool.shutdown();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "omr-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
