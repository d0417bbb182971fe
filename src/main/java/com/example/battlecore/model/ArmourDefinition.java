package com.example.battlecore.model;

public record ArmourDefinition(String id, String name, String slot, int defense) {
}
