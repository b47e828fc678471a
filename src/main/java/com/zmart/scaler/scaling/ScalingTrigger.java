package com.zmart.scaler.scaling;

/**
 * Reason to add the next stage. Ordered from most to least urgent.
 */
public enum ScalingTrigger {

    /** Price within the emergency buffer of the liquidation estimate. */
    EMERGENCY("Emergency"),

    /** Price within the liquidation buffer. */
    LIQUIDATION_PROXIMITY("Liquidation proximity"),

    /** Signal score improved on the score the position was opened with. */
    BETTER_SCORE("Better score"),

    NONE("None");

    private final String displayName;

    ScalingTrigger(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
