package com.poker.tracker.stats;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds hands into counters and turns counters into statistics snapshots.
 * Full recomputation splits the hands into chunks folded in parallel; an
 * incremental update folds only new hands into the previous counters.
 */
@Slf4j
@Component
public class StatisticsAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final HandStatisticsExtractor extractor;
    private final int chunkSize;

    public StatisticsAggregator(HandStatisticsExtractor extractor,
                                @Value("${pipeline.stats.chunk-size:500}") int chunkSize) {
        Preconditions.checkArgument(chunkSize > 0, "pipeline.stats.chunk-size must be positive");
        this.extractor = extractor;
        this.chunkSize = chunkSize;
    }

    /**
     * Full recomputation over every given hand matching the filter.
     */
    public Statistics compute(String user, Collection<Hand> hands, StatisticsFilter filter) {
        filter.validate();
        long start = System.currentTimeMillis();
        AggregateCounters counters = foldAll(hands, filter);
        log.debug("Folded {} hands for {} in {}ms", hands.size(), user, System.currentTimeMillis() - start);
        return snapshot(user, filter, counters, 1);
    }

    /**
     * Folds only the new hands into the counters of the previous snapshot.
     * The previous snapshot's filter applies to the delta.
     */
    public Statistics update(Statistics previous, Collection<Hand> delta) {
        StatisticsFilter filter = previous.getFilter();
        filter.validate();
        AggregateCounters counters = fold(previous.getCounters(), delta, filter);
        return snapshot(previous.getUser(), filter, counters, previous.getGeneration() + 1);
    }

    /**
     * Partitions the hands and folds the chunks in parallel.
     */
    public AggregateCounters foldAll(Collection<Hand> hands, StatisticsFilter filter) {
        List<List<Hand>> chunks = Lists.partition(new ArrayList<>(hands), chunkSize);
        return chunks.parallelStream()
                .map(chunk -> fold(new AggregateCounters(), chunk, filter))
                .reduce(new AggregateCounters(), AggregateCounters::merge);
    }

    /**
     * Adds the matching hands to a copy of {@code previous}. The argument is
     * not modified.
     */
    public AggregateCounters fold(AggregateCounters previous, Collection<Hand> hands, StatisticsFilter filter) {
        previous.validate();
        AggregateCounters counters = previous.copy();
        for (Hand hand : hands) {
            if (!filter.matches(hand)) {
                continue;
            }
            StatisticsCounters single = extractor.extract(hand);
            counters.getOverall().add(single);
            if (hand.getHeroPosition() != null) {
                counters.getByPosition()
                        .computeIfAbsent(hand.getHeroPosition(), p -> new StatisticsCounters())
                        .add(single);
            }
            if (hand.getPlayedAt() != null) {
                counters.getByDay()
                        .computeIfAbsent(hand.getPlayedAt().toLocalDate().toString(), d -> new StatisticsCounters())
                        .add(single);
            }
        }
        return counters;
    }

    /**
     * Divides counters into a snapshot.
     *
     * @throws AggregationException if the counters are inconsistent
     */
    public Statistics snapshot(String user, StatisticsFilter filter, AggregateCounters counters, long generation) {
        counters.validate();
        StatisticsCounters overall = counters.getOverall();

        Map<Position, PositionalStatistics> positional = new EnumMap<>(Position.class);
        counters.getByPosition().forEach((position, c) -> positional.put(position, PositionalStatistics.builder()
                .position(position)
                .hands(c.getHands())
                .rates(rates(c))
                .aggressionFactor(aggressionFactor(c))
                .winRateBb100(winRate(c))
                .netWinnings(c.getNetWinnings())
                .build()));

        List<TrendBucket> trends = new ArrayList<>();
        new TreeMap<>(counters.getByDay()).forEach((day, c) -> trends.add(TrendBucket.builder()
                .day(LocalDate.parse(day))
                .hands(c.getHands())
                .vpip(Rate.of(c.getOrEmpty(StatKey.VPIP)))
                .pfr(Rate.of(c.getOrEmpty(StatKey.PFR)))
                .aggressionFactor(aggressionFactor(c))
                .winRateBb100(winRate(c))
                .netWinnings(c.getNetWinnings())
                .build()));

        return Statistics.builder()
                .user(user)
                .filter(filter)
                .filterFingerprint(filter.fingerprint())
                .generation(generation)
                .hands(overall.getHands())
                .rates(rates(overall))
                .aggressionFactor(aggressionFactor(overall))
                .winRateBb100(winRate(overall))
                .netWinnings(overall.getNetWinnings())
                .redLineWinnings(overall.getRedLine())
                .blueLineWinnings(overall.getBlueLine())
                .positional(ImmutableMap.copyOf(positional))
                .trends(ImmutableList.copyOf(trends))
                .counters(counters.copy())
                .build();
    }

    private static ImmutableMap<StatKey, Rate> rates(StatisticsCounters counters) {
        ImmutableMap.Builder<StatKey, Rate> rates = ImmutableMap.builder();
        for (StatKey key : StatKey.values()) {
            rates.put(key, Rate.of(counters.getOrEmpty(key)));
        }
        return rates.build();
    }

    private static Double aggressionFactor(StatisticsCounters counters) {
        if (counters.getCalls() == 0) {
            return null;
        }
        return (double) counters.getAggressiveActions() / counters.getCalls();
    }

    private static Double winRate(StatisticsCounters counters) {
        if (counters.getHands() == 0) {
            return null;
        }
        return counters.getNetBigBlinds()
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(counters.getHands()), 4, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
