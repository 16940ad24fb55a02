package com.poker.tracker.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poker.tracker.HandFixtures;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatisticsFilter")
class StatisticsFilterTest {

    @Test
    @DisplayName("1. Equal filters share a fingerprint, different ones do not")
    void fingerprint() {
        StatisticsFilter a = StatisticsFilter.builder().gameFormat(GameFormat.CASH).stakes("$0.05/$0.10").build();
        StatisticsFilter b = StatisticsFilter.builder().stakes("$0.05/$0.10").gameFormat(GameFormat.CASH).build();
        StatisticsFilter c = StatisticsFilter.builder().gameFormat(GameFormat.TOURNAMENT).stakes("$0.05/$0.10").build();

        assertThat(a.fingerprint()).isEqualTo(b.fingerprint()).hasSize(32);
        assertThat(a.fingerprint()).isNotEqualTo(c.fingerprint());
        assertThat(StatisticsFilter.ALL.fingerprint()).isNotEqualTo(a.fingerprint());
    }

    @Test
    @DisplayName("2. Matching on stakes, format and play money")
    void matches() {
        // Given
        Hand hand = HandFixtures.session(HandFixtures.WALK_ID);

        // Then
        assertThat(StatisticsFilter.ALL.matches(hand)).isTrue();
        assertThat(StatisticsFilter.builder().stakes("$0.05/$0.10").build().matches(hand)).isTrue();
        assertThat(StatisticsFilter.builder().stakes("$0.25/$0.50").build().matches(hand)).isFalse();
        assertThat(StatisticsFilter.builder().gameFormat(GameFormat.TOURNAMENT).build().matches(hand)).isFalse();
        assertThat(StatisticsFilter.builder().playMoney(true).build().matches(hand)).isFalse();
        assertThat(StatisticsFilter.builder().dateFrom(LocalDate.of(2024, 1, 16)).build().matches(hand)).isTrue();
        assertThat(StatisticsFilter.builder().dateTo(LocalDate.of(2024, 1, 15)).build().matches(hand)).isFalse();
    }

    @Test
    @DisplayName("3. Blank stakes are rejected")
    void blankStakes() {
        assertThatThrownBy(() -> StatisticsFilter.builder().stakes(" ").build().validate())
                .isInstanceOf(AggregationException.class);
    }

    @Test
    @DisplayName("4. JSON round trip keeps the fingerprint")
    void json() throws Exception {
        // Given
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
        StatisticsFilter filter = StatisticsFilter.builder()
                .dateFrom(LocalDate.of(2024, 1, 1))
                .gameFormat(GameFormat.CASH)
                .playMoney(false)
                .build();

        // When
        StatisticsFilter read = mapper.readValue(mapper.writeValueAsString(filter), StatisticsFilter.class);

        // Then
        assertThat(read).isEqualTo(filter);
        assertThat(read.fingerprint()).isEqualTo(filter.fingerprint());
    }
}
