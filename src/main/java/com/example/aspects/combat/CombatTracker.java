package com.example.aspects.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process adapter for the external initiative tracker: holds the turn
 * order and fires {@link TurnChange} events when advanced. Outside combat the
 * round is 0.
 */
public class CombatTracker implements TurnNotifier {

    private static final Logger logger = LoggerFactory.getLogger(CombatTracker.class);

    private final List<TurnListener> listeners = new CopyOnWriteArrayList<>();
    private final List<String> order = new ArrayList<>();
    private int round;
    private int turn;

    /** Starts combat at round 1 with the first combatant in {@code turnOrder}. */
    public void start(List<String> turnOrder) {
        order.clear();
        order.addAll(turnOrder);
        round = 1;
        turn = 0;
        logger.info("[CombatTracker] Combat started with {} combatants", order.size());
        fire(new TurnChange(round, turn, null, current(), true));
    }

    /** Moves to the next combatant, wrapping into a new round after the last. */
    public void nextTurn() {
        if (order.isEmpty()) return;
        String ended = current();
        boolean roundChanged = false;
        turn++;
        if (turn >= order.size()) {
            turn = 0;
            round++;
            roundChanged = true;
        }
        fire(new TurnChange(round, turn, ended, current(), roundChanged));
    }

    public void end() {
        logger.info("[CombatTracker] Combat ended at round {}", round);
        order.clear();
        round = 0;
        turn = 0;
    }

    public String current() {
        return order.isEmpty() ? null : order.get(turn);
    }

    @Override
    public int currentRound() { return round; }

    @Override
    public int currentTurn() { return turn; }

    @Override
    public void addListener(TurnListener listener) { listeners.add(listener); }

    @Override
    public void removeListener(TurnListener listener) { listeners.remove(listener); }

    private void fire(TurnChange change) {
        logger.debug("[CombatTracker] Round {} turn {}: {} -> {}", change.round(), change.turn(),
            change.endedCombatantId(), change.startedCombatantId());
        for (TurnListener l : listeners) l.onTurnChange(change);
    }
}
