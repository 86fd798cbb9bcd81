package com.questrail.scenario.expression;

import com.questrail.scenario.api.ScenarioConfigurationException;
import com.questrail.scenario.condition.ModuleRegistry;
import com.questrail.scenario.condition.ProcedureModule;

import java.util.Objects;

/**
 * Resolves a procedure's module name against a {@link ModuleRegistry}.
 *
 * <p>Names are matched exactly against the registry's declared names and
 * the first match wins. The returned instance is owned by the calling
 * procedure node; nothing is cached here.</p>
 */
public final class ProcedureDispatcher
{
    private ProcedureDispatcher() {}

    /**
     * @throws ScenarioConfigurationException if no declared module has this name
     */
    public static ProcedureModule load(ModuleRegistry registry, String name) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(name, "name");

        for (String declared : registry.declaredNames()) {
            if (declared.equals(name)) {
                return registry.resolve(declared).orElseThrow(() ->
                        new ScenarioConfigurationException(
                                "Module registry declares " + name + " but could not create it"));
            }
        }
        throw new ScenarioConfigurationException("Failed to load procedure " + name);
    }
}
