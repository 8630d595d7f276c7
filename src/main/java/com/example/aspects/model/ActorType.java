package com.example.aspects.model;

public enum ActorType {
    CHARACTER, NPC, FAMILIAR
}
