package com.example.aspects.authority;

import com.example.aspects.area.TemplateStore;
import com.example.aspects.chat.ChatMessage;
import com.example.aspects.chat.Notifier;
import com.example.aspects.effect.ApplyOutcome;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.equipment.EquipmentSystem;
import com.example.aspects.model.Actor;
import com.example.aspects.model.GearItem;
import com.example.aspects.model.ResourcePool;
import com.example.aspects.model.ResourceType;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies intents to shared state. Every kind of mutation the engine performs
 * on someone else's data goes through {@link #execute}.
 */
public class IntentExecutor {

    private static final Logger logger = LoggerFactory.getLogger(IntentExecutor.class);

    public static final String STRONGER_EXISTS = "Existing buff is stronger, no change.";

    private final EntityStore store;
    private final EffectLedger ledger;
    private final EquipmentSystem equipment;
    private final StatEngine engine;
    private final TemplateStore templates;
    private final Notifier notifier;

    public IntentExecutor(EntityStore store, EffectLedger ledger, EquipmentSystem equipment,
                          StatEngine engine, TemplateStore templates, Notifier notifier) {
        this.store = store;
        this.ledger = ledger;
        this.equipment = equipment;
        this.engine = engine;
        this.templates = templates;
        this.notifier = notifier;
    }

    public void execute(Intent intent) {
        switch (intent.kind()) {
            case APPLY_DAMAGE:
                applyDamage((Intent.ApplyDamage) intent);
                break;
            case RESTORE_RESOURCE:
                restore((Intent.RestoreResource) intent);
                break;
            case SPEND_RESOURCE:
                spend((Intent.SpendResource) intent);
                break;
            case APPLY_EFFECT:
                applyEffect((Intent.ApplyEffect) intent);
                break;
            case REMOVE_EFFECTS:
                removeEffects((Intent.RemoveEffects) intent);
                break;
            case REPAIR_EQUIPMENT:
                repair((Intent.RepairEquipment) intent);
                break;
            case EQUIP_ITEM:
                equipment.equip(((Intent.EquipItem) intent).itemId());
                break;
            case UNEQUIP_ITEM:
                equipment.unequip(((Intent.UnequipItem) intent).itemId());
                break;
            case REPAIR_ITEM:
                Intent.RepairItem r = (Intent.RepairItem) intent;
                equipment.repair(r.itemId(), r.kitId());
                break;
            case DEGRADE_WEAPON:
                degradeWeapon((Intent.DegradeWeapon) intent);
                break;
            case CREATE_TEMPLATE:
                templates.create(((Intent.CreateTemplate) intent).template());
                break;
            case DELETE_TEMPLATE:
                templates.delete(((Intent.DeleteTemplate) intent).templateId());
                break;
            default:
                throw new IllegalStateException("Unhandled intent kind " + intent.kind());
        }
    }

    private void applyDamage(Intent.ApplyDamage i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        int lost = -target.getResource(ResourceType.HEALTH).adjust(-Math.max(0, i.amount()));
        logger.info("[IntentExecutor] {} takes {} {} damage from {}", target.getName(), lost, i.damageType(), i.source());
        notifier.post(ChatMessage.of(target.getName(), i.source(), target.getName() + " takes " + lost + " damage."));
        if (i.durabilityDamage() > 0) equipment.degradeDurability(target, i.durabilityDamage(), i.damageType());
    }

    private void restore(Intent.RestoreResource i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        ResourcePool pool = target.getResource(i.resource());
        int restored = pool.adjust(Math.max(0, i.amount()));
        logger.info("[IntentExecutor] {} restores {} {}", target.getName(), restored, i.resource().key);
        notifier.post(ChatMessage.of(target.getName(), i.source(),
            target.getName() + " restores " + restored + " " + i.resource().displayName + "."));
    }

    private void spend(Intent.SpendResource i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        target.getResource(i.resource()).adjust(-Math.max(0, i.amount()));
        logger.debug("[IntentExecutor] {} spent {} {} on {}", target.getName(), i.amount(), i.resource().key, i.source());
    }

    private void applyEffect(Intent.ApplyEffect i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        ApplyOutcome outcome = ledger.applyEffect(target, i.spec());
        if (outcome == ApplyOutcome.UNCHANGED) {
            notifier.post(ChatMessage.of(target.getName(), i.spec().name(), STRONGER_EXISTS));
            return;
        }
        engine.refresh(target);
    }

    private void removeEffects(Intent.RemoveEffects i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        if (ledger.removeEffectsByOrigin(target, i.originId()) > 0) engine.refresh(target);
    }

    private void repair(Intent.RepairEquipment i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        int restored = equipment.repairAllEquipped(target, i.amount(), i.materials());
        String text = restored > 0
            ? "Repaired " + restored + " durability on " + target.getName() + "'s equipment."
            : target.getName() + " has no damaged equipment to repair.";
        notifier.post(ChatMessage.of(target.getName(), i.source(), text));
    }

    private void degradeWeapon(Intent.DegradeWeapon i) {
        Actor target = actor(i.targetActorId());
        if (target == null) return;
        Optional<GearItem> weapon = target.findItem(i.weaponId()).filter(GearItem.class::isInstance).map(GearItem.class::cast);
        if (weapon.isEmpty()) {
            logger.warn("[IntentExecutor] {} has no weapon {}", target.getName(), i.weaponId());
            return;
        }
        equipment.degradeWeaponOnAttack(target, weapon.get(), i.rawDamage());
    }

    private Actor actor(String actorId) {
        Optional<Actor> a = store.findActor(actorId);
        if (a.isEmpty()) logger.warn("[IntentExecutor] Unknown actor {}", actorId);
        return a.orElse(null);
    }
}
