package com.poker.tracker.stats;

import com.poker.tracker.model.Action;
import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Position;
import com.poker.tracker.model.Street;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the hero's counters from a single hand. A "decision" is any
 * voluntary action of the hero; the big blind does not count as a raise.
 */
@Component
public class HandStatisticsExtractor {

    public StatisticsCounters extract(Hand hand) {
        StatisticsCounters counters = new StatisticsCounters();
        counters.setHands(1);

        String hero = hand.getHeroName();
        Preflop preflop = walkPreflop(hand, hero);

        countPreflop(counters, preflop);
        countSteal(counters, hand, hero);
        countPostflop(counters, hand, hero, preflop.aggressor);
        countAggression(counters, hand, hero);
        countResults(counters, hand, hero);
        return counters;
    }

    private static final class Preflop {
        int decisions;
        boolean voluntaryPut;
        boolean raised;
        boolean postedBlind;

        ActionType firstDecision;
        int firstFacing = -1;

        Boolean threeBet;
        Boolean fourBet;
        Boolean foldToThreeBet;
        Boolean foldToFourBet;
        Boolean foldToSteal;

        String aggressor;
    }

    private Preflop walkPreflop(Hand hand, String hero) {
        Preflop facts = new Preflop();
        Position heroPosition = hand.getHeroPosition();
        List<String> raisers = new ArrayList<>();
        boolean openedByFolds = true;
        boolean firstRaiseIsSteal = false;

        for (Action action : hand.actionsOn(Street.PREFLOP)) {
            ActionType type = action.getType();
            boolean byHero = action.getPlayer().equals(hero);

            if (type.isForced()) {
                if (byHero && type.isBlind()) {
                    facts.postedBlind = true;
                }
                continue;
            }

            if (byHero) {
                int facing = raisers.size();
                facts.decisions++;
                if (facts.firstDecision == null) {
                    facts.firstDecision = type;
                    facts.firstFacing = facing;
                }
                if (type != ActionType.FOLD && type != ActionType.CHECK) {
                    facts.voluntaryPut = true;
                }
                if (type.isAggressive()) {
                    facts.raised = true;
                }
                if (facing == 1 && facts.threeBet == null) {
                    facts.threeBet = type.isAggressive();
                }
                if (facing == 2 && facts.fourBet == null) {
                    facts.fourBet = type.isAggressive();
                }
                if (facing >= 2 && facts.foldToThreeBet == null
                        && raisers.get(0).equals(hero) && !raisers.get(1).equals(hero)) {
                    facts.foldToThreeBet = type == ActionType.FOLD;
                }
                if (facing >= 3 && facts.foldToFourBet == null
                        && raisers.get(1).equals(hero) && !raisers.get(2).equals(hero)) {
                    facts.foldToFourBet = type == ActionType.FOLD;
                }
                if (facing == 1 && facts.decisions == 1 && firstRaiseIsSteal
                        && Position.BLINDS.contains(heroPosition)) {
                    facts.foldToSteal = type == ActionType.FOLD;
                }
            }

            if (type.isAggressive()) {
                if (raisers.isEmpty()) {
                    Position raiserPosition = hand.getPositions().get(action.getPlayer());
                    firstRaiseIsSteal = openedByFolds && !byHero
                            && Position.STEAL_POSITIONS.contains(raiserPosition);
                }
                raisers.add(action.getPlayer());
            }
            if (type != ActionType.FOLD) {
                openedByFolds = false;
            }
        }

        facts.aggressor = raisers.isEmpty() ? null : raisers.get(raisers.size() - 1);
        return facts;
    }

    private void countPreflop(StatisticsCounters counters, Preflop facts) {
        if (facts.decisions > 0) {
            counters.rate(StatKey.VPIP).record(facts.voluntaryPut);
            counters.rate(StatKey.PFR).record(facts.raised);
        }
        if (facts.threeBet != null) {
            counters.rate(StatKey.THREE_BET).record(facts.threeBet);
        }
        if (facts.fourBet != null) {
            counters.rate(StatKey.FOUR_BET).record(facts.fourBet);
        }
        if (facts.foldToThreeBet != null) {
            counters.rate(StatKey.FOLD_TO_THREE_BET).record(facts.foldToThreeBet);
        }
        if (facts.foldToFourBet != null) {
            counters.rate(StatKey.FOLD_TO_FOUR_BET).record(facts.foldToFourBet);
        }
        if (!facts.postedBlind && facts.firstDecision != null && facts.firstFacing >= 1) {
            counters.rate(StatKey.COLD_CALL).record(facts.firstDecision == ActionType.CALL);
        }
        if (facts.foldToSteal != null) {
            counters.rate(StatKey.FOLD_TO_STEAL).record(facts.foldToSteal);
        }
    }

    private void countPostflop(StatisticsCounters counters, Hand hand, String hero, String aggressor) {
        boolean heroFolded = false;
        boolean heroAllIn = false;
        for (Action action : hand.actionsOn(Street.PREFLOP)) {
            if (action.getPlayer().equals(hero)) {
                heroFolded |= action.getType() == ActionType.FOLD;
                heroAllIn |= action.isAllIn();
            }
        }

        for (Street street : Street.POSTFLOP) {
            if (heroFolded || !hand.isStreetDealt(street)) {
                break;
            }
            List<Action> actions = hand.actionsOn(street);
            int heroFirst = indexOf(actions, hero, 0);

            if (hero.equals(aggressor) && !heroAllIn && heroFirst >= 0) {
                counters.rate(StatKey.cbet(street)).record(actions.get(heroFirst).getType() == ActionType.BET);
            }

            if (aggressor != null && !hero.equals(aggressor)) {
                int aggressorFirst = indexOf(actions, aggressor, 0);
                if (aggressorFirst >= 0 && actions.get(aggressorFirst).getType() == ActionType.BET) {
                    int response = indexOf(actions, hero, aggressorFirst + 1);
                    if (response >= 0) {
                        counters.rate(StatKey.foldToCbet(street))
                                .record(actions.get(response).getType() == ActionType.FOLD);
                    }
                }
            }

            if (heroFirst >= 0 && actions.get(heroFirst).getType() == ActionType.CHECK) {
                int bet = -1;
                for (int i = heroFirst + 1; i < actions.size(); i++) {
                    if (!actions.get(i).getPlayer().equals(hero) && actions.get(i).getType().isAggressive()) {
                        bet = i;
                        break;
                    }
                }
                if (bet >= 0) {
                    int response = indexOf(actions, hero, bet + 1);
                    if (response >= 0) {
                        counters.rate(StatKey.checkRaise(street))
                                .record(actions.get(response).getType() == ActionType.RAISE);
                    }
                }
            }

            for (Action action : actions) {
                if (action.getPlayer().equals(hero)) {
                    heroFolded |= action.getType() == ActionType.FOLD;
                    heroAllIn |= action.isAllIn();
                }
            }
        }
    }

    private void countSteal(StatisticsCounters counters, Hand hand, String hero) {
        if (!Position.STEAL_POSITIONS.contains(hand.getHeroPosition())) {
            return;
        }
        for (Action action : hand.actionsOn(Street.PREFLOP)) {
            if (action.getType().isForced()) {
                continue;
            }
            if (action.getPlayer().equals(hero)) {
                counters.rate(StatKey.STEAL).record(action.getType().isAggressive());
                return;
            }
            if (action.getType() != ActionType.FOLD) {
                return;
            }
        }
    }

    private void countAggression(StatisticsCounters counters, Hand hand, String hero) {
        for (Action action : hand.actionsBy(hero)) {
            if (action.getType().isAggressive()) {
                counters.setAggressiveActions(counters.getAggressiveActions() + 1);
            } else if (action.getType() == ActionType.CALL) {
                counters.setCalls(counters.getCalls() + 1);
            }
        }
    }

    private void countResults(StatisticsCounters counters, Hand hand, String hero) {
        boolean sawFlop = hand.isStreetDealt(Street.FLOP)
                && hand.actionsOn(Street.PREFLOP).stream()
                .noneMatch(a -> a.getPlayer().equals(hero) && a.getType() == ActionType.FOLD);
        boolean reachedShowdown = hand.isShowdown() && !hand.hasFolded(hero);

        if (sawFlop) {
            counters.rate(StatKey.WTSD).record(reachedShowdown);
        }
        if (reachedShowdown) {
            counters.rate(StatKey.WSD).record(hand.collectedBy(hero).signum() > 0);
        }

        BigDecimal net = hand.netFor(hero);
        counters.setNetWinnings(net);
        BigDecimal bigBlind = hand.getBlinds().getBig();
        if (bigBlind != null && bigBlind.signum() > 0) {
            counters.setNetBigBlinds(net.divide(bigBlind, 4, RoundingMode.HALF_UP));
        }
        if (reachedShowdown) {
            counters.setBlueLine(net);
        } else {
            counters.setRedLine(net);
        }
    }

    private static int indexOf(List<Action> actions, String player, int from) {
        for (int i = from; i < actions.size(); i++) {
            if (actions.get(i).getPlayer().equals(player)) {
                return i;
            }
        }
        return -1;
    }
}
