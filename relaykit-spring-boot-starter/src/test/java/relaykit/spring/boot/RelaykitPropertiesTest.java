package relaykit.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelaykitPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(RelaykitProperties.class);
            assertEquals(4, props.getRelay().getWorkerCount());
            assertEquals(1024, props.getRelay().getMailboxCapacity());
            assertEquals(1000, props.getRelay().getPublishTimeoutMs());
            assertEquals(5000, props.getRelay().getDrainTimeoutMs());
            assertTrue(props.getPreferences().isEnabled());
            assertNull(props.getPreferences().getFile());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("relaykit", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "relaykit.relay.worker-count=2",
                "relaykit.relay.mailbox-capacity=16",
                "relaykit.relay.publish-timeout-ms=0",
                "relaykit.relay.drain-timeout-ms=250",
                "relaykit.preferences.enabled=false",
                "relaykit.preferences.file=/tmp/prefs.json",
                "relaykit.metrics.enabled=false",
                "relaykit.metrics.name-prefix=ui.relay"
        ).run(ctx -> {
            var props = ctx.getBean(RelaykitProperties.class);
            assertEquals(2, props.getRelay().getWorkerCount());
            assertEquals(16, props.getRelay().getMailboxCapacity());
            assertEquals(0, props.getRelay().getPublishTimeoutMs());
            assertEquals(250, props.getRelay().getDrainTimeoutMs());
            assertFalse(props.getPreferences().isEnabled());
            assertEquals("/tmp/prefs.json", props.getPreferences().getFile());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("ui.relay", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(RelaykitProperties.class)
    static class PropsConfig {
    }
}
