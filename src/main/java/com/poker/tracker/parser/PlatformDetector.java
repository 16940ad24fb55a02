package com.poker.tracker.parser;

import com.poker.tracker.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Identifies the platform of a hand-history file from its first header line.
 * Only the first non-blank line is consulted.
 */
@Slf4j
@Component
public class PlatformDetector {

    public Platform detect(String text) {
        if (text == null) {
            throw new UnsupportedPlatformException("No hand-history text");
        }
        String first = HandTextSupport.lines(text).stream()
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElseThrow(() -> new UnsupportedPlatformException("Hand-history text is empty"));

        List<Platform> matches = Arrays.stream(Platform.values())
                .filter(p -> p.getHeaderPattern().matcher(first).lookingAt())
                .toList();

        if (matches.size() != 1) {
            throw new UnsupportedPlatformException(matches.isEmpty()
                    ? "Unrecognised hand-history header: " + abbreviate(first)
                    : "Ambiguous hand-history header matches " + matches);
        }
        log.debug("Detected {} from header '{}'", matches.get(0), abbreviate(first));
        return matches.get(0);
    }

    /**
     * Returns the hint when one is given, otherwise detects.
     */
    public Platform resolve(String text, Platform hint) {
        return hint != null ? hint : detect(text);
    }

    /**
     * Number of hand headers in the text, used as the expected hand count.
     */
    public int countHands(String text, Platform platform) {
        return HandTextSupport.countHeaders(text, platform.getHeaderPattern());
    }

    private static String abbreviate(String line) {
        return line.length() > 60 ? line.substring(0, 60) + "..." : line;
    }
}
