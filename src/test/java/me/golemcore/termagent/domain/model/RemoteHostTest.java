package me.golemcore.termagent.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RemoteHostTest {

    @Test
    void shouldParseUserAndHostWithDefaultPort() {
        // Act
        RemoteHost host = RemoteHost.parse("deploy@example.org");

        // Assert
        assertEquals("deploy", host.user());
        assertEquals("example.org", host.host());
        assertEquals(RemoteHost.DEFAULT_PORT, host.port());
        assertEquals("deploy@example.org", host.toString());
    }

    @Test
    void shouldParseExplicitPort() {
        // Act
        RemoteHost host = RemoteHost.parse(" root@10.0.0.5:2222 ");

        // Assert
        assertEquals(2222, host.port());
        assertEquals("root@10.0.0.5", host.destination());
        assertEquals("root@10.0.0.5:2222", host.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = { "example.org", "@example.org", "deploy@", "deploy@host:abc", "deploy@host:70000",
            "deploy@:22" })
    void shouldRejectMalformedTargets(String value) {
        assertThrows(IllegalArgumentException.class, () -> RemoteHost.parse(value));
    }

    @Test
    void shouldParseExecutionModeAliases() {
        assertEquals(ExecutionMode.AUTONOMOUS, ExecutionMode.fromValue("auto"));
        assertEquals(ExecutionMode.CONFIRM_EACH, ExecutionMode.fromValue("confirm_each"));
        assertEquals(ExecutionMode.CONFIRM_EACH, ExecutionMode.fromValue(null));
        assertThrows(IllegalArgumentException.class, () -> ExecutionMode.fromValue("yolo"));
    }
}
