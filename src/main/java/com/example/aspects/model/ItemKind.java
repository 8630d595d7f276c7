package com.example.aspects.model;

public enum ItemKind {
    GEAR, SKILL, AUGMENT, TEMPLATE, FEATURE
}
