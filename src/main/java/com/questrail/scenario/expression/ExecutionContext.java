package com.questrail.scenario.expression;

import com.questrail.scenario.api.EntityRegistry;
import com.questrail.scenario.api.ScenarioEvaluationException;
import com.questrail.scenario.api.SimulatorApi;
import com.questrail.scenario.intersection.IntersectionRegistry;

import java.util.Optional;

/**
 * ExecutionContext
 * -----------------------------------------------------------------------------
 * The collaborators one evaluation pass may touch: the simulator, the entity
 * registry and the intersection registry.
 *
 * <p>Each collaborator is optional when the context is built but required by
 * whichever procedure uses it. The plain accessors return {@link Optional} so
 * a missing collaborator is an ordinary, testable outcome; the
 * {@code require*} accessors turn absence into a
 * {@link ScenarioEvaluationException} that aborts the tick.</p>
 *
 * <p>The context is immutable and passed by reference into every node
 * evaluation.</p>
 */
public final class ExecutionContext
{
    private static final ExecutionContext EMPTY = new Builder().build();

    private final SimulatorApi simulator;
    private final EntityRegistry entities;
    private final IntersectionRegistry intersections;

    private ExecutionContext(Builder builder) {
        this.simulator = builder.simulator;
        this.entities = builder.entities;
        this.intersections = builder.intersections;
    }

    /**
     * A context with no collaborators at all.
     */
    public static ExecutionContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SimulatorApi> simulator() {
        return Optional.ofNullable(simulator);
    }

    public Optional<EntityRegistry> entities() {
        return Optional.ofNullable(entities);
    }

    public Optional<IntersectionRegistry> intersections() {
        return Optional.ofNullable(intersections);
    }

    public SimulatorApi requireSimulator() {
        return require(simulator, "simulator");
    }

    public EntityRegistry requireEntities() {
        return require(entities, "entities");
    }

    public IntersectionRegistry requireIntersections() {
        return require(intersections, "intersections");
    }

    private static <T> T require(T collaborator, String name) {
        if (collaborator == null) {
            throw new ScenarioEvaluationException(
                    "No " + name + " defined, but scenario execution requires this.");
        }
        return collaborator;
    }

    public static final class Builder {
        private SimulatorApi simulator;
        private EntityRegistry entities;
        private IntersectionRegistry intersections;

        private Builder() {}

        public Builder withSimulator(SimulatorApi simulator) {
            this.simulator = simulator;
            return this;
        }

        public Builder withEntities(EntityRegistry entities) {
            this.entities = entities;
            return this;
        }

        public Builder withIntersections(IntersectionRegistry intersections) {
            this.intersections = intersections;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
