package com.example.aspects.combat;

@FunctionalInterface
public interface TurnListener {
    void onTurnChange(TurnChange change);
}
