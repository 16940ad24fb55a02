package com.poker.tracker.ingest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ImportRequest {

    String user;

    // null to take the player from each hand's "Dealt to" line
    String heroName;

    @Singular
    List<RawHandFile> files;
}
