package com.example.aspects.skill;

import com.example.aspects.model.DamageType;
import com.example.aspects.model.Defense;

/** Which defense an attack is rolled against and which mitigation applies. */
public record AttackConfig(Defense defense, DamageType damageType) {

    public AttackConfig {
        if (defense == null) defense = Defense.MELEE;
        if (damageType == null) damageType = DamageType.PHYSICAL;
    }
}
