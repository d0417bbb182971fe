package com.example.battlecore.combat;

/**
 * A battle action was invalid. Always thrown before anything was mutated, so the caller can
 * simply ask for a different action.
 */
public class ActionRejectedException extends RuntimeException {
    
    private final RejectionReason reason;
    
    public ActionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
    
    public RejectionReason getReason() {
        return reason;
    }
}
