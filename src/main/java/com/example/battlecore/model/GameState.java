package com.example.battlecore.model;

import com.example.battlecore.util.DeterministicRng;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persistent state that outlives a single battle.
 * A persistence layer must round-trip every field here, including the RNG state.
 */
public class GameState {
    
    private Player player;
    
    /** Recruited party member ids, in party order */
    private final List<String> partyMemberIds = new ArrayList<>();
    
    private final Map<String, Attributes> partyMemberAttributes = new HashMap<>();
    
    /** Equipped summon ids per party member; the player's live on {@link Player} */
    private final Map<String, List<String>> partyMemberSummons = new HashMap<>();
    
    /** Equipment per member id, the player included */
    private final Map<String, Equipment> equipment = new HashMap<>();
    
    private final PartyInventory inventory = new PartyInventory();
    
    private int gold;
    
    private final Map<String, Integer> memberLevels = new HashMap<>();
    private final Map<String, Integer> memberExp = new HashMap<>();
    
    /** Kills per knowledge key */
    private final Map<String, Integer> knowledgeKillCounts = new HashMap<>();
    
    private boolean lastBattleDefeat;
    
    private DeterministicRng rng;
    
    public GameState(DeterministicRng rng) {
        this.rng = Objects.requireNonNull(rng, "rng");
    }
    
    public Player getPlayer() { return player; }
    
    public void setPlayer(Player player) { this.player = player; }
    
    public List<String> getPartyMemberIds() { return partyMemberIds; }
    
    public void addPartyMember(String memberId) {
        if (!partyMemberIds.contains(memberId)) {
            partyMemberIds.add(memberId);
        }
    }
    
    public Map<String, Attributes> getPartyMemberAttributes() { return partyMemberAttributes; }
    
    public Map<String, List<String>> getPartyMemberSummons() { return partyMemberSummons; }
    
    public Map<String, Equipment> getEquipment() { return equipment; }
    
    public Equipment getEquipment(String memberId) {
        return equipment.get(memberId);
    }
    
    public PartyInventory getInventory() { return inventory; }
    
    public int getGold() { return gold; }
    
    public void setGold(int gold) { this.gold = gold; }
    
    public void addGold(int amount) { this.gold += amount; }
    
    public Map<String, Integer> getMemberLevels() { return memberLevels; }
    
    public Map<String, Integer> getMemberExp() { return memberExp; }
    
    public int getLevel(String memberId) {
        return memberLevels.getOrDefault(memberId, 1);
    }
    
    public int getExp(String memberId) {
        return memberExp.getOrDefault(memberId, 0);
    }
    
    public Map<String, Integer> getKnowledgeKillCounts() { return knowledgeKillCounts; }
    
    public boolean isLastBattleDefeat() { return lastBattleDefeat; }
    
    public void setLastBattleDefeat(boolean lastBattleDefeat) { this.lastBattleDefeat = lastBattleDefeat; }
    
    public DeterministicRng getRng() { return rng; }
    
    public void setRng(DeterministicRng rng) { this.rng = Objects.requireNonNull(rng, "rng"); }
}
