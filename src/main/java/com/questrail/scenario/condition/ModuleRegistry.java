package com.questrail.scenario.condition;

import java.util.Optional;
import java.util.Set;

/**
 * Source of {@link ProcedureModule}s, keyed by full module name
 * ({@code TimeoutCondition}, {@code ChangeIntersectionAction}).
 *
 * <p>Implementations may load modules from anywhere; the engine only relies
 * on the two operations below.</p>
 */
public interface ModuleRegistry
{
    /**
     * Creates a fresh, unconfigured module, or empty when {@code name} is unknown.
     */
    Optional<ProcedureModule> resolve(String name);

    /**
     * Every name {@link #resolve} answers to, in lookup order.
     */
    Set<String> declaredNames();
}
