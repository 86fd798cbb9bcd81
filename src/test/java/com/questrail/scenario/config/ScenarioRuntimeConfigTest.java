package com.questrail.scenario.config;

import com.questrail.scenario.condition.DefaultModuleRegistry;
import com.questrail.scenario.observability.NullObservabilitySink;
import com.questrail.scenario.observability.Slf4jScenarioObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRuntimeConfigTest
{
    @Test
    void defaultsLogThroughSlf4jAndUseBuiltInModules() {
        ScenarioRuntimeConfig config = ScenarioRuntimeConfig.defaults();

        assertInstanceOf(Slf4jScenarioObservabilitySink.class, config.observabilitySink());
        assertTrue(config.modules().declaredNames().contains("TimeoutCondition"));
        assertFalse(config.reassertSignalsEachTick());
    }

    @Test
    void builderOverridesEveryField() {
        Clock clock = Clock.systemDefaultZone();
        ScenarioRuntimeConfig config = ScenarioRuntimeConfig.builder()
                .withModules(DefaultModuleRegistry.builder().includeBuiltIns(false).build())
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .withClock(clock)
                .withReassertSignalsEachTick(true)
                .build();

        assertTrue(config.modules().declaredNames().isEmpty());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertSame(clock, config.clock());
        assertTrue(config.reassertSignalsEachTick());
    }

    @Test
    void nullCollaboratorsAreRejected() {
        assertThrows(NullPointerException.class,
                () -> ScenarioRuntimeConfig.builder().withModules(null).build());
        assertThrows(NullPointerException.class,
                () -> ScenarioRuntimeConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class,
                () -> ScenarioRuntimeConfig.builder().withClock(null).build());
    }
}
