package com.poker.tracker.stats;

import com.google.common.hash.Hashing;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import com.poker.tracker.model.Position;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

/**
 * Scope of a statistics request. Null fields do not restrict.
 */
@Value
@Builder
@Jacksonized
public class StatisticsFilter {

    public static final StatisticsFilter ALL = StatisticsFilter.builder().build();

    LocalDate dateFrom;
    LocalDate dateTo;
    GameFormat gameFormat;
    String stakes;
    Position position;
    Platform platform;
    Boolean playMoney;

    public void validate() {
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new AggregationException("Filter date range is inverted: " + dateFrom + " > " + dateTo);
        }
        if (stakes != null && stakes.isBlank()) {
            throw new AggregationException("Filter stakes must not be blank");
        }
    }

    public boolean matches(Hand hand) {
        if (dateFrom != null || dateTo != null) {
            if (hand.getPlayedAt() == null) {
                return false;
            }
            LocalDate day = hand.getPlayedAt().toLocalDate();
            if (dateFrom != null && day.isBefore(dateFrom)) {
                return false;
            }
            if (dateTo != null && day.isAfter(dateTo)) {
                return false;
            }
        }
        return (gameFormat == null || gameFormat == hand.getGameFormat())
                && (stakes == null || stakes.equals(hand.getStakes()))
                && (position == null || position == hand.getHeroPosition())
                && (platform == null || platform == hand.getPlatform())
                && (playMoney == null || playMoney == hand.isPlayMoney());
    }

    /**
     * Stable hash of the filter, used as part of the cache key.
     */
    public String fingerprint() {
        String canonical = "from=" + dateFrom
                + "|to=" + dateTo
                + "|format=" + gameFormat
                + "|stakes=" + stakes
                + "|position=" + position
                + "|platform=" + platform
                + "|playMoney=" + playMoney;
        return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString().substring(0, 32);
    }
}
