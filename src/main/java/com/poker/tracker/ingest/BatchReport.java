package com.poker.tracker.ingest;

import com.poker.tracker.model.Hand;
import lombok.Value;

import java.util.List;

/**
 * Per-file reports in input order, plus batch-wide views.
 */
@Value
public class BatchReport {

    List<FileReport> files;
    boolean cancelled;

    public List<Hand> getAccepted() {
        return files.stream()
                .flatMap(f -> f.getAccepted().stream())
                .toList();
    }

    public int getDuplicates() {
        return files.stream().mapToInt(FileReport::getDuplicates).sum();
    }

    public List<HandFailure> getFailures() {
        return files.stream()
                .flatMap(f -> f.getFailures().stream())
                .toList();
    }

    public List<FileReport> getFileErrors() {
        return files.stream()
                .filter(f -> f.getFileError() != null)
                .toList();
    }
}
