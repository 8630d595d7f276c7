package com.example.aspects.equipment;

/** Result of validating whether an item fits its slot. */
public record SlotCheck(boolean allowed, String reason) {

    private static final SlotCheck OK = new SlotCheck(true, null);

    public static SlotCheck ok() { return OK; }

    public static SlotCheck denied(String reason) { return new SlotCheck(false, reason); }
}
