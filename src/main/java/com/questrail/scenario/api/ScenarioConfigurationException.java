package com.questrail.scenario.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Indicates that a scenario description could not be turned into an
 * evaluable scenario.
 *
 * This is raised at construction time, before any tick runs, and typically
 * reflects:
 * <ul>
 *   <li>a malformed expression or intersection block</li>
 *   <li>a missing required key</li>
 *   <li>a procedure type no registered module answers to</li>
 *   <li>a reference to an undeclared intersection or intersection state</li>
 * </ul>
 *
 * When known, the offending document fragment is carried along and appended
 * to the message.
 */
public class ScenarioConfigurationException extends RuntimeException
{
    private final transient JsonNode fragment;

    public ScenarioConfigurationException(String message) {
        this(message, null, null);
    }

    public ScenarioConfigurationException(String message, JsonNode fragment) {
        this(message, fragment, null);
    }

    public ScenarioConfigurationException(String message, JsonNode fragment, Throwable cause) {
        super(render(message, fragment), cause);
        this.fragment = fragment;
    }

    /**
     * Returns the document fragment that failed to configure, if known.
     */
    public Optional<JsonNode> fragment() {
        return Optional.ofNullable(fragment);
    }

    private static String render(String message, JsonNode fragment) {
        if (fragment == null || fragment.isMissingNode()) {
            return message;
        }
        return message + "\n\n" + fragment.toPrettyString() + "\n";
    }
}
