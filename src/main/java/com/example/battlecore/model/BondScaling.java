package com.example.battlecore.model;

/**
 * Per-point-of-BOND stat growth of a summon.
 */
public record BondScaling(double hpPerBond, double attackPerBond, double defensePerBond, double speedPerBond) {
    
    public static final BondScaling NONE = new BondScaling(0, 0, 0, 0);
}
