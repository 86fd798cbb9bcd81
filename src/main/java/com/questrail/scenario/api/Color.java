package com.questrail.scenario.api;

import java.util.Locale;

/**
 * Traffic-light lamp color as understood by the simulator.
 * <p>
 * {@link #BLANK} is not a lamp: it asks for the signal to be reset to its
 * off/neutral rendering.
 */
public enum Color
{
    GREEN("Green"),
    YELLOW("Yellow"),
    RED("Red"),
    BLANK("Blank");

    private final String wireName;

    Color(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the name the simulator expects, e.g. {@code "Green"}.
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Parses a scenario color name, ignoring case. {@code "Amber"} is accepted
     * as an alias of {@link #YELLOW}.
     *
     * @throws IllegalArgumentException if the text names no color
     */
    public static Color parse(String text)
    {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "green" -> GREEN;
            case "yellow", "amber" -> YELLOW;
            case "red" -> RED;
            case "blank", "" -> BLANK;
            default -> throw new IllegalArgumentException("Unknown traffic light color: " + text);
        };
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
