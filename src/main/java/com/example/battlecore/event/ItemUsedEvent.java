package com.example.battlecore.event;

/**
 * @param hadEffect false when the item changed nothing, such as a debuff the target already carried
 */
public record ItemUsedEvent(String userId, String userName,
                            String itemId, String itemName,
                            String targetId, String targetName,
                            int hpRestored, int mpRestored, boolean hadEffect) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.ITEM_USED;
    }
}
