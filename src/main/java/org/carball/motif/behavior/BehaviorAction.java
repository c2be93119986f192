package org.carball.motif.behavior;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of user interaction with a solution and the weight each one adds to
 * the category and tech stack counters.
 */
public enum BehaviorAction {
    VIEW("view", 1),
    APPLY("apply", 3),
    FAVORITE("favorite", 2),
    RATE("rate", 0);

    private final String value;
    private final int baseWeight;

    BehaviorAction(String value, int baseWeight) {
        this.value = value;
        this.baseWeight = baseWeight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * A rating scales to {@code round(rating / 5 * 5)}; other actions have a
     * fixed weight and ignore the rating.
     */
    public int weight(Double rating) {
        if (this == RATE) {
            return rating == null ? 0 : (int) Math.round(rating / 5.0 * 5.0);
        }
        return baseWeight;
    }

    @JsonCreator
    public static BehaviorAction fromValue(String value) {
        for (BehaviorAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown behavior action: " + value);
    }
}
