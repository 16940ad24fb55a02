package com.poker.tracker.ingest;

import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of importing one file. {@code fileError} is set when the file as a
 * whole could not be processed.
 */
@Value
@Builder
public class FileReport {

    String fileName;
    Platform platform;

    @Singular("acceptedHand")
    List<Hand> accepted;

    @Singular
    List<String> duplicateHandIds;

    @Singular
    List<HandFailure> failures;

    String fileError;

    public int getDuplicates() {
        return duplicateHandIds.size();
    }

    public static FileReport error(String fileName, String message) {
        return FileReport.builder()
                .fileName(fileName)
                .fileError(message)
                .build();
    }
}
