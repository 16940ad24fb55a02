package com.poker.tracker.parser;

import com.poker.tracker.model.Platform;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a detected platform to its grammar.
 */
@Component
public class ParserRegistry {

    private final Map<Platform, HandHistoryParser> parsers = new EnumMap<>(Platform.class);

    public ParserRegistry(List<HandHistoryParser> parsers) {
        for (HandHistoryParser parser : parsers) {
            HandHistoryParser previous = this.parsers.put(parser.platform(), parser);
            if (previous != null) {
                throw new IllegalStateException("Two parsers registered for " + parser.platform());
            }
        }
    }

    public HandHistoryParser get(Platform platform) {
        HandHistoryParser parser = parsers.get(platform);
        if (parser == null) {
            throw new UnsupportedPlatformException("No parser for " + platform);
        }
        return parser;
    }
}
