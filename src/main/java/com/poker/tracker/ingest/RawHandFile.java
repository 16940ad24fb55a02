package com.poker.tracker.ingest;

import com.poker.tracker.model.Platform;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RawHandFile {

    String name;
    String text;

    // null to detect from the header
    Platform platformHint;
}
