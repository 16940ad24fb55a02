package com.poker.tracker.parser;

import com.google.common.collect.ImmutableList;
import com.poker.tracker.model.Hand;
import lombok.Value;

@Value
public class ParseResult {

    ImmutableList<Hand> hands;
    ImmutableList<ParseFailure> failures;
}
