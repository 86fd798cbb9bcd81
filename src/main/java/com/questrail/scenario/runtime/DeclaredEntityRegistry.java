package com.questrail.scenario.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.scenario.api.EntityRegistry;
import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.config.ConfigNodes;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link EntityRegistry} holding the names a scenario's {@code Entity} block
 * declares.
 */
public final class DeclaredEntityRegistry implements EntityRegistry
{
    private final Set<String> names;

    public DeclaredEntityRegistry(Collection<String> names) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /**
     * Reads {@code Entity: [{Name: ...}, ...]}. A missing block declares no entities.
     */
    public static DeclaredEntityRegistry fromConfig(JsonNode entities) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        if (entities == null || entities.isMissingNode() || entities.isNull()) {
            return new DeclaredEntityRegistry(names);
        }
        if (!entities.isArray()) {
            throw new ScenarioConfigurationException("'Entity' must be a sequence", entities);
        }
        for (JsonNode entity : entities) {
            String name = ConfigNodes.requireText(entity, "Name");
            if (!names.add(name)) {
                throw new ScenarioConfigurationException("Entity '" + name + "' is declared twice", entity);
            }
        }
        return new DeclaredEntityRegistry(names);
    }

    @Override
    public boolean exists(String name) {
        return names.contains(name);
    }

    @Override
    public Set<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return "DeclaredEntityRegistry" + names;
    }
}
