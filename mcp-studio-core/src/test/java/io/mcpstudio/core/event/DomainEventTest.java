package io.mcpstudio.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DomainEventTest {

    @Test
    void shouldExposeDottedTypes() {
        assertThat(DomainEvent.ConnectionEstablished.now("s1").type())
                .isEqualTo("connection.established");
        assertThat(DomainEvent.ConnectionLost.now("s1", "boom", "heartbeat_failed").type())
                .isEqualTo("connection.lost");
        assertThat(DomainEvent.ToolInvoked.now("s1", "echo", true).type()).isEqualTo("tool.invoked");
        assertThat(DomainEvent.ToolsRefreshed.now("s1", 2).type()).isEqualTo("tools.refreshed");
    }

    @Test
    void shouldAllowMissingErrorAndReasonOnConnectionLost() {
        DomainEvent.ConnectionLost event = DomainEvent.ConnectionLost.now("s1", null, null);

        assertThat(event.serverId()).isEqualTo("s1");
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void shouldRequireServerId() {
        assertThatThrownBy(() -> DomainEvent.ConnectionEstablished.now(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("serverId");
    }
}
