package com.poker.tracker.ingest;

import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import com.poker.tracker.parser.HandHistoryParser;
import com.poker.tracker.parser.HandParseException;
import com.poker.tracker.parser.ParserRegistry;
import com.poker.tracker.parser.PlatformDetector;
import com.poker.tracker.parser.UnsupportedPlatformException;
import com.poker.tracker.validation.HandRegistry;
import com.poker.tracker.validation.HandValidator;
import com.poker.tracker.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a batch import: detect, parse and validate every hand of every file.
 * Files are processed in parallel on the import executor, hands within a file
 * one after another. Failures are collected per hand and never abort the batch.
 */
@Service
@Slf4j
public class BatchOrchestrator {

    private final PlatformDetector detector;
    private final ParserRegistry parsers;
    private final HandValidator validator;
    private final HandRegistry handRegistry;
    private final ExecutorService importExecutor;
    private final ExecutorService jobRunner;

    public BatchOrchestrator(PlatformDetector detector,
                             ParserRegistry parsers,
                             HandValidator validator,
                             HandRegistry handRegistry,
                             @Qualifier("importExecutor") ExecutorService importExecutor,
                             @Qualifier("importJobExecutor") ExecutorService jobRunner) {
        this.detector = detector;
        this.parsers = parsers;
        this.validator = validator;
        this.handRegistry = handRegistry;
        this.importExecutor = importExecutor;
        this.jobRunner = jobRunner;
    }

    /**
     * Starts the import in the background, or queues it while the job pool is
     * busy. The report is delivered through {@link ImportJob#getResult()}.
     */
    public ImportJob submit(ImportRequest request) {
        ImportJob job = new ImportJob();
        jobRunner.execute(() -> {
            try {
                job.getResult().complete(importBatch(request, job));
            } catch (RuntimeException e) {
                log.error("Import job {} failed: {}", job.getId(), e.getMessage(), e);
                job.getResult().completeExceptionally(e);
            }
        });
        return job;
    }

    public BatchReport importBatch(ImportRequest request, ImportJob job) {
        ImportProgress progress = job.getProgress();
        List<RawHandFile> files = request.getFiles();
        Instant start = Instant.now();
        log.info("=== IMPORT {}: {} files for user {} ===", job.getId(), files.size(), request.getUser());

        progress.step("Detecting platforms");
        List<Platform> platforms = new ArrayList<>();
        List<String> detectionErrors = new ArrayList<>();
        int expected = 0;
        for (RawHandFile file : files) {
            try {
                if (file.getText() == null || file.getText().isBlank()) {
                    throw new UnsupportedPlatformException("File is empty");
                }
                Platform platform = detector.resolve(file.getText(), file.getPlatformHint());
                platforms.add(platform);
                detectionErrors.add(null);
                expected += detector.countHands(file.getText(), platform);
            } catch (UnsupportedPlatformException e) {
                log.warn("Skipping file {}: {}", file.getName(), e.getMessage());
                platforms.add(null);
                detectionErrors.add(e.getMessage());
            }
        }
        progress.expect(expected);

        progress.step("Importing hands");
        List<Future<FileReport>> pending = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            RawHandFile file = files.get(i);
            Platform platform = platforms.get(i);
            if (platform == null) {
                pending.add(CompletableFuture.completedFuture(FileReport.error(file.getName(), detectionErrors.get(i))));
            } else {
                pending.add(importExecutor.submit(() -> importFile(file, platform, request, job)));
            }
        }

        List<FileReport> reports = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            reports.add(await(pending.get(i), files.get(i).getName(), job));
        }

        boolean cancelled = job.isCancelled();
        BatchReport report = new BatchReport(List.copyOf(reports), cancelled);
        progress.complete(cancelled ? "Cancelled" : "Completed");
        log.info("=== IMPORT {} {}: {} accepted, {} duplicates, {} failed, {} file errors in {}ms ===",
                job.getId(), cancelled ? "CANCELLED" : "COMPLETED",
                report.getAccepted().size(), report.getDuplicates(), report.getFailures().size(),
                report.getFileErrors().size(), Duration.between(start, Instant.now()).toMillis());
        return report;
    }

    private FileReport importFile(RawHandFile file, Platform platform, ImportRequest request, ImportJob job) {
        HandHistoryParser parser = parsers.get(platform);
        FileReport.FileReportBuilder report = FileReport.builder()
                .fileName(file.getName())
                .platform(platform);

        List<String> blocks = parser.split(file.getText());
        log.info("File {}: {} hands ({})", file.getName(), blocks.size(), platform.getDisplayName());
        for (String block : blocks) {
            if (job.isCancelled()) {
                log.info("File {}: import cancelled", file.getName());
                break;
            }
            boolean failed = importHand(parser, block, request, report);
            job.getProgress().handProcessed(failed);
        }
        return report.build();
    }

    /**
     * @return true if the hand failed
     */
    private boolean importHand(HandHistoryParser parser, String block, ImportRequest request,
                               FileReport.FileReportBuilder report) {
        String handId = parser.handIdOf(block);
        try {
            Hand hand = parser.parseHand(block, request.getHeroName());
            ValidationResult result = validator.validate(hand, request.getUser(), handRegistry);
            switch (result.getStatus()) {
                case ACCEPTED -> report.acceptedHand(hand);
                case DUPLICATE -> {
                    log.info("Hand {} already imported, skipping", hand.getHandId());
                    report.duplicateHandId(hand.getHandId());
                }
                case REJECTED -> {
                    String reason = String.join("; ", result.getReasons());
                    log.warn("Hand {} rejected: {}", hand.getHandId(), reason);
                    report.failure(new HandFailure(hand.getHandId(), FailureKind.VALIDATION_ERROR, reason));
                    return true;
                }
            }
            return false;
        } catch (HandParseException e) {
            log.warn("Hand {} not parsed: {}", handId, e.getMessage());
            report.failure(new HandFailure(handId, FailureKind.PARSE_ERROR, e.getMessage()));
            return true;
        } catch (RuntimeException e) {
            log.error("Unexpected error in hand {}: {}", handId, e.getMessage(), e);
            report.failure(new HandFailure(handId, FailureKind.PARSE_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
            return true;
        }
    }

    private FileReport await(Future<FileReport> future, String fileName, ImportJob job) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancel();
            return FileReport.error(fileName, "Interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("File {} failed: {}", fileName, cause.getMessage(), cause);
            return FileReport.error(fileName, cause.getMessage());
        }
    }
}
