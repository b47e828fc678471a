package com.zmart.scaler.position;

/**
 * State-transition notifications emitted to the execution layer.
 */
public enum PositionEventType {

    FIRST_TAKE_TRIGGERED("First take-profit", "Margin reached the first take-profit trigger"),

    /**
     * Only emitted when a follow-up take policy is active.
     */
    SECOND_TAKE_TRIGGERED("Second take-profit", "Trailing stop hit, partial take and tight stop re-armed"),

    TRAILING_STOP_HIT("Trailing stop hit", "Price crossed the trailing stop, remainder closed"),

    POSITION_CLOSED("Position closed", "Closed by explicit command");

    private final String displayName;
    private final String description;

    PositionEventType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True when the event ends the position.
     */
    public boolean isTerminal() {
        return this == TRAILING_STOP_HIT || this == POSITION_CLOSED;
    }
}
