package com.questrail.scenario.config;

import com.questrail.scenario.condition.DefaultModuleRegistry;
import com.questrail.scenario.condition.ModuleRegistry;
import com.questrail.scenario.observability.ScenarioObservabilitySink;
import com.questrail.scenario.observability.Slf4jScenarioObservabilitySink;

import java.time.Clock;
import java.util.Objects;

/**
 * Aggregated configuration for a scenario run.
 *
 * @param modules                 modules procedure nodes resolve against
 * @param observabilitySink       receives transitions, actuator failures, verdicts and errors
 * @param clock                   timestamps observability events; never drives conditions
 * @param reassertSignalsEachTick re-issue every intersection's current state before each tick
 */
public record ScenarioRuntimeConfig(
    ModuleRegistry modules,
    ScenarioObservabilitySink observabilitySink,
    Clock clock,
    boolean reassertSignalsEachTick
) {
    public ScenarioRuntimeConfig {
        Objects.requireNonNull(modules, "modules");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
    }

    public static ScenarioRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ModuleRegistry modules = DefaultModuleRegistry.defaultRegistry();
        private ScenarioObservabilitySink observabilitySink = new Slf4jScenarioObservabilitySink();
        private Clock clock = Clock.systemUTC();
        private boolean reassertSignalsEachTick = false;

        public Builder withModules(ModuleRegistry modules) {
            this.modules = modules;
            return this;
        }

        public Builder withObservabilitySink(ScenarioObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withReassertSignalsEachTick(boolean reassert) {
            this.reassertSignalsEachTick = reassert;
            return this;
        }

        public ScenarioRuntimeConfig build() {
            return new ScenarioRuntimeConfig(modules, observabilitySink, clock, reassertSignalsEachTick);
        }
    }
}
