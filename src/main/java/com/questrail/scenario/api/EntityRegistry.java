package com.questrail.scenario.api;

import java.util.Set;

/**
 * Read-only view of the entities (ego vehicle, NPCs, pedestrians) a scenario
 * declares.
 * <p>
 * Spawning and tracking entities is the simulator's business; conditions only
 * need to know whether a name they reference exists.
 */
public interface EntityRegistry
{
    /**
     * @param name entity name as written in the scenario
     * @return {@code true} if the scenario declares an entity with this name
     */
    boolean exists(String name);

    /**
     * @return every declared entity name, in declaration order
     */
    Set<String> names();
}
