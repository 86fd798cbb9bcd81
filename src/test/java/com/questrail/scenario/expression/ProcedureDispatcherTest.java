package com.questrail.scenario.expression;

import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.CountingModule;
import com.questrail.scenario.condition.ModuleRegistry;
import com.questrail.scenario.condition.ProcedureModule;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProcedureDispatcherTest
{
    /**
     * Registry whose declared names and resolvable names can differ.
     */
    static final class FixedRegistry implements ModuleRegistry {
        private final Set<String> declared;
        private final Set<String> resolvable;

        FixedRegistry(List<String> declared, List<String> resolvable) {
            this.declared = new LinkedHashSet<>(declared);
            this.resolvable = new LinkedHashSet<>(resolvable);
        }

        @Override
        public Optional<ProcedureModule> resolve(String name) {
            return resolvable.contains(name)
                    ? Optional.of(new CountingModule(name))
                    : Optional.empty();
        }

        @Override
        public Set<String> declaredNames() {
            return declared;
        }
    }

    @Test
    void resolvesExactName() {
        ModuleRegistry registry = new FixedRegistry(
                List.of("SpeedCondition", "TimeoutCondition"),
                List.of("SpeedCondition", "TimeoutCondition"));

        ProcedureModule module = ProcedureDispatcher.load(registry, "TimeoutCondition");

        assertEquals("TimeoutCondition", module.type());
    }

    @Test
    void matchingIsCaseSensitive() {
        ModuleRegistry registry = new FixedRegistry(List.of("TimeoutCondition"), List.of("TimeoutCondition"));

        ScenarioConfigurationException e = assertThrows(ScenarioConfigurationException.class,
                () -> ProcedureDispatcher.load(registry, "timeoutCondition"));
        assertEquals("Failed to load procedure timeoutCondition", e.getMessage());
    }

    @Test
    void undeclaredNameIsNotResolvedEvenIfRegistryCouldCreateIt() {
        ModuleRegistry registry = new FixedRegistry(List.of(), List.of("HiddenCondition"));

        assertThrows(ScenarioConfigurationException.class,
                () -> ProcedureDispatcher.load(registry, "HiddenCondition"));
    }

    @Test
    void declaredButUnresolvableNameFails() {
        ModuleRegistry registry = new FixedRegistry(List.of("BrokenCondition"), List.of());

        assertThrows(ScenarioConfigurationException.class,
                () -> ProcedureDispatcher.load(registry, "BrokenCondition"));
    }
}
