package io.arrconf.observability;

import io.arrconf.model.InstanceRef;
import io.arrconf.model.RunStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RunLogContextTest {
    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void nestedScopesRestorePreviousValues() {
        try (RunLogContext stage = RunLogContext.stage(RunStage.APPLY_UPDATES)) {
            assertEquals(RunStage.APPLY_UPDATES.label(), MDC.get(RunLogContext.STAGE));
            try (RunLogContext hd = RunLogContext.instance(InstanceRef.of("sonarr", "sonarr-hd"))) {
                assertEquals("sonarr", MDC.get(RunLogContext.PLUGIN));
                assertEquals("sonarr-hd", MDC.get(RunLogContext.INSTANCE));
                try (RunLogContext plugin = RunLogContext.plugin("radarr")) {
                    assertEquals("radarr", MDC.get(RunLogContext.PLUGIN));
                    assertNull(MDC.get(RunLogContext.INSTANCE));
                }
                assertEquals("sonarr", MDC.get(RunLogContext.PLUGIN));
                assertEquals("sonarr-hd", MDC.get(RunLogContext.INSTANCE));
            }
            assertNull(MDC.get(RunLogContext.PLUGIN));
            assertNull(MDC.get(RunLogContext.INSTANCE));
            assertEquals(RunStage.APPLY_UPDATES.label(), MDC.get(RunLogContext.STAGE));
        }
        assertNull(MDC.get(RunLogContext.STAGE));
    }
}
