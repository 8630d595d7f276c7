package com.example.aspects.authority;

import com.example.aspects.area.AreaTemplate;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.ResourceType;

import java.util.List;

/**
 * An immutable request to mutate shared state. Participants build intents and
 * hand them to the {@link AuthorityRouter}; only the {@link IntentExecutor}
 * applies them.
 */
public interface Intent {

    IntentKind kind();

    /** Actor whose state the intent changes, or null for scene-level intents. */
    String targetActorId();

    /**
     * Health loss. {@code durabilityDamage} is spread over the target's armor
     * (physical) or veil (magical) gear.
     */
    record ApplyDamage(String targetActorId, int amount, DamageType damageType, int durabilityDamage, String source)
            implements Intent {
        public IntentKind kind() { return IntentKind.APPLY_DAMAGE; }
    }

    record RestoreResource(String targetActorId, ResourceType resource, int amount, String source) implements Intent {
        public IntentKind kind() { return IntentKind.RESTORE_RESOURCE; }
    }

    record SpendResource(String targetActorId, ResourceType resource, int amount, String source) implements Intent {
        public IntentKind kind() { return IntentKind.SPEND_RESOURCE; }
    }

    record ApplyEffect(String targetActorId, EffectSpec spec) implements Intent {
        public IntentKind kind() { return IntentKind.APPLY_EFFECT; }
    }

    record RemoveEffects(String targetActorId, String originId) implements Intent {
        public IntentKind kind() { return IntentKind.REMOVE_EFFECTS; }
    }

    record RepairEquipment(String targetActorId, int amount, List<String> materials, String source) implements Intent {
        public RepairEquipment {
            materials = materials != null ? List.copyOf(materials) : List.of();
        }
        public IntentKind kind() { return IntentKind.REPAIR_EQUIPMENT; }
    }

    record EquipItem(String targetActorId, String itemId) implements Intent {
        public IntentKind kind() { return IntentKind.EQUIP_ITEM; }
    }

    record UnequipItem(String targetActorId, String itemId) implements Intent {
        public IntentKind kind() { return IntentKind.UNEQUIP_ITEM; }
    }

    /** One use of a repair kit on a single item. */
    record RepairItem(String targetActorId, String itemId, String kitId) implements Intent {
        public IntentKind kind() { return IntentKind.REPAIR_ITEM; }
    }

    record DegradeWeapon(String targetActorId, String weaponId, int rawDamage) implements Intent {
        public IntentKind kind() { return IntentKind.DEGRADE_WEAPON; }
    }

    record CreateTemplate(AreaTemplate template) implements Intent {
        public IntentKind kind() { return IntentKind.CREATE_TEMPLATE; }
        public String targetActorId() { return null; }
    }

    record DeleteTemplate(String templateId) implements Intent {
        public IntentKind kind() { return IntentKind.DELETE_TEMPLATE; }
        public String targetActorId() { return null; }
    }
}
