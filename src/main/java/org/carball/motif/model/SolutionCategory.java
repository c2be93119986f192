package org.carball.motif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SolutionCategory {
    ENTRANCE("entrance"),
    EXIT("exit"),
    TRANSITION("transition"),
    INTERACTION("interaction"),
    EFFECT("effect"),
    COMPOSITE("composite");

    private final String value;

    SolutionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SolutionCategory fromValue(String value) {
        for (SolutionCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown solution category: " + value);
    }
}
