package com.example.aspects.combat;

/**
 * A turn change observed from the external turn-order tracker.
 *
 * @param round              round number after the change
 * @param turn               turn index within the round after the change
 * @param endedCombatantId   actor whose turn just ended, may be null at combat start
 * @param startedCombatantId actor whose turn begins, may be null at combat end
 * @param roundChanged       true when this change crossed a round boundary
 */
public record TurnChange(int round, int turn, String endedCombatantId, String startedCombatantId, boolean roundChanged) {
}
