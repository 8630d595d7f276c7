package com.example.aspects.combat;

/**
 * Read side of the external turn-order tracker. The engine never schedules
 * turns; it only observes them.
 */
public interface TurnNotifier {

    int currentRound();

    int currentTurn();

    void addListener(TurnListener listener);

    void removeListener(TurnListener listener);
}
