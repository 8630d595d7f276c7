package com.example.aspects.equipment;

import com.example.aspects.model.EquipmentSlot;

import java.util.List;

/** Occupancy of one slot, for display. */
public record SlotUsage(EquipmentSlot slot, int capacity, List<String> itemIds) {

    public int used() { return itemIds.size(); }

    public boolean isFull() { return used() >= capacity; }
}
