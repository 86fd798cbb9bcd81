package com.questrail.scenario.condition;

import com.questrail.scenario.condition.impl.ChangeIntersectionAction;
import com.questrail.scenario.condition.impl.IntersectionStateCondition;
import com.questrail.scenario.condition.impl.SpeedCondition;
import com.questrail.scenario.condition.impl.TimeoutCondition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable name-to-factory {@link ModuleRegistry}.
 *
 * <p>Custom registrations override built-ins when names collide. Every
 * {@link #resolve} call creates a new module instance.</p>
 */
public final class DefaultModuleRegistry implements ModuleRegistry
{
    private final Map<String, Supplier<? extends ProcedureModule>> factories;

    private DefaultModuleRegistry(Map<String, Supplier<? extends ProcedureModule>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * Returns a registry holding the built-in modules only.
     */
    public static DefaultModuleRegistry defaultRegistry() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<ProcedureModule> resolve(String name) {
        Supplier<? extends ProcedureModule> factory = factories.get(name);
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(Objects.requireNonNull(factory.get(), name));
    }

    @Override
    public Set<String> declaredNames() {
        return factories.keySet();
    }

    private static Map<String, Supplier<? extends ProcedureModule>> builtIns() {
        LinkedHashMap<String, Supplier<? extends ProcedureModule>> builtIns = new LinkedHashMap<>();
        builtIns.put("TimeoutCondition", TimeoutCondition::new);
        builtIns.put("SpeedCondition", SpeedCondition::new);
        builtIns.put("IntersectionStateCondition", IntersectionStateCondition::new);
        builtIns.put("ChangeIntersectionAction", ChangeIntersectionAction::new);
        return builtIns;
    }

    public static final class Builder {
        private final LinkedHashMap<String, Supplier<? extends ProcedureModule>> custom = new LinkedHashMap<>();
        private boolean includeBuiltIns = true;

        private Builder() {}

        public Builder includeBuiltIns(boolean includeBuiltIns) {
            this.includeBuiltIns = includeBuiltIns;
            return this;
        }

        public Builder register(String name, Supplier<? extends ProcedureModule> factory) {
            String normalized = Objects.requireNonNull(name, "name").trim();
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("name must be non-blank");
            }
            custom.put(normalized, Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public DefaultModuleRegistry build() {
            LinkedHashMap<String, Supplier<? extends ProcedureModule>> merged = new LinkedHashMap<>();
            if (includeBuiltIns) {
                merged.putAll(builtIns());
            }
            merged.putAll(custom);
            return new DefaultModuleRegistry(merged);
        }
    }
}
