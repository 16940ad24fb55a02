package com.poker.tracker.parser;

import lombok.Value;

@Value
public class ParseFailure {

    // null when the block header could not be read
    String handId;
    String reason;
}
