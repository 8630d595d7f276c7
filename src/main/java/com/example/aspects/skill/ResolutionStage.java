package com.example.aspects.skill;

/** Stages a skill activation passes through, in order. */
public enum ResolutionStage {
    IDLE,
    VALIDATING_RESOURCE,
    ROLL_BUILDING,
    ROLL_EVALUATING,
    AREA_PLACEMENT,
    TAG_DISPATCH,
    RESOURCE_DEDUCTION,
    DONE,
    ABORTED
}
