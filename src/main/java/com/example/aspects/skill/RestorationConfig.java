package com.example.aspects.skill;

import com.example.aspects.model.ResourceType;

public record RestorationConfig(ResourceType resource, TargetMode target) {

    public RestorationConfig {
        if (resource == null) resource = ResourceType.HEALTH;
        if (target == null) target = TargetMode.SELECTED;
    }
}
