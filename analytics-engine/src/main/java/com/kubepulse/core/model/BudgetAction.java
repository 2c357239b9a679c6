package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Action a budget policy rule requests once its threshold is reached.
 * Declared in ascending order of severity.
 *
 * @since 1.0.0
 */
public enum BudgetAction {

    NOTIFY("notify"),
    ALERT("alert"),
    PAGE("page");

    private final String wireName;

    BudgetAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @param value action name; must be one of {@code notify}, {@code alert},
     *              {@code page} (case-insensitive)
     * @return matching action
     * @throws IllegalArgumentException if {@code value} is not a known action
     */
    @JsonCreator
    public static BudgetAction fromWireName(String value) {
        if (value != null) {
            String normalised = value.trim().toLowerCase(Locale.ROOT);
            for (BudgetAction action : values()) {
                if (action.wireName.equals(normalised)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown budget action: '" + value + "'. Supported: notify, alert, page");
    }
}
