package com.questrail.scenario.api;

import java.util.Locale;

/**
 * Traffic-light arrow as understood by the simulator.
 * <p>
 * {@link #BLANK} never reaches the simulator; it is dropped when a state's
 * arrow list is read.
 */
public enum Arrow
{
    LEFT("Left"),
    RIGHT("Right"),
    STRAIGHT("Straight"),
    BLANK("Blank");

    private final String wireName;

    Arrow(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    /**
     * Parses a scenario arrow name, ignoring case. {@code "Up"} is accepted
     * as an alias of {@link #STRAIGHT}.
     *
     * @throws IllegalArgumentException if the text names no arrow
     */
    public static Arrow parse(String text)
    {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "straight", "up" -> STRAIGHT;
            case "blank", "" -> BLANK;
            default -> throw new IllegalArgumentException("Unknown traffic light arrow: " + text);
        };
    }

    @Override
    public String toString()
    {
        return wireName;
    }
}
