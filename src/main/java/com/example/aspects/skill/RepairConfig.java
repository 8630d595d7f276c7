package com.example.aspects.skill;

import java.util.List;

/** Materials a repair skill can work on; empty means any. */
public record RepairConfig(List<String> materials) {

    public RepairConfig {
        materials = materials != null ? List.copyOf(materials) : List.of();
    }
}
