package com.example.battlecore.model;

/**
 * Mutable current stats of a living entity.
 * 
 * The player's instance is shared between {@link Player} and the player's battle combatant,
 * so HP and MP spent in battle persist into the game state.
 */
public class Stats {
    
    private int maxHp;
    private int hp;
    private int maxMp;
    private int mp;
    private int attack;
    private int defense;
    private int speed;
    
    public Stats(int maxHp, int hp, int maxMp, int mp, int attack, int defense, int speed) {
        this.maxHp = maxHp;
        this.hp = hp;
        this.maxMp = maxMp;
        this.mp = mp;
        this.attack = attack;
        this.defense = defense;
        this.speed = speed;
    }
    
    public int getMaxHp() { return maxHp; }
    public int getHp() { return hp; }
    public int getMaxMp() { return maxMp; }
    public int getMp() { return mp; }
    public int getAttack() { return attack; }
    public int getDefense() { return defense; }
    public int getSpeed() { return speed; }
    
    public void setMaxHp(int maxHp) { this.maxHp = maxHp; }
    public void setMaxMp(int maxMp) { this.maxMp = maxMp; }
    public void setAttack(int attack) { this.attack = attack; }
    public void setDefense(int defense) { this.defense = defense; }
    public void setSpeed(int speed) { this.speed = speed; }
    
    /** Set HP, clamped to [0, maxHp]. */
    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(hp, maxHp));
    }
    
    /** Set MP, clamped to [0, maxMp]. */
    public void setMp(int mp) {
        this.mp = Math.max(0, Math.min(mp, maxMp));
    }
    
    public boolean isAlive() {
        return hp > 0;
    }
    
    public void restoreHp() { this.hp = maxHp; }
    
    public void restoreMp() { this.mp = maxMp; }
    
    /**
     * Copy every field from another stat block into this one, keeping this object's identity.
     */
    public void copyFrom(Stats other) {
        this.maxHp = other.maxHp;
        this.hp = other.hp;
        this.maxMp = other.maxMp;
        this.mp = other.mp;
        this.attack = other.attack;
        this.defense = other.defense;
        this.speed = other.speed;
    }
    
    public Stats copy() {
        return new Stats(maxHp, hp, maxMp, mp, attack, defense, speed);
    }
    
    @Override
    public String toString() {
        return "Stats{hp=" + hp + "/" + maxHp + ", mp=" + mp + "/" + maxMp
                + ", atk=" + attack + ", def=" + defense + ", spd=" + speed + "}";
    }
}
