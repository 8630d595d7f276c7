package com.example.aspects.authority;

public enum IntentKind {
    APPLY_DAMAGE,
    RESTORE_RESOURCE,
    SPEND_RESOURCE,
    APPLY_EFFECT,
    REMOVE_EFFECTS,
    REPAIR_EQUIPMENT,
    EQUIP_ITEM,
    UNEQUIP_ITEM,
    REPAIR_ITEM,
    DEGRADE_WEAPON,
    CREATE_TEMPLATE,
    DELETE_TEMPLATE
}
