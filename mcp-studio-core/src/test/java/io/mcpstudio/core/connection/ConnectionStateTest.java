package io.mcpstudio.core.connection;

import static org.assertj.core.api.Assertions.assertThat;

import io.mcpstudio.core.server.ServerDescriptor;
import io.mcpstudio.core.server.TransportKind;
import org.junit.jupiter.api.Test;

class ConnectionStateTest {

    @Test
    void shouldExposeLowercaseLabels() {
        assertThat(ConnectionState.DISCONNECTED.label()).isEqualTo("disconnected");
        assertThat(ConnectionState.CONNECTING.label()).isEqualTo("connecting");
        assertThat(ConnectionState.CONNECTED.label()).isEqualTo("connected");
        assertThat(ConnectionState.error("boom").label()).isEqualTo("error");
    }

    @Test
    void shouldOnlyReportConnectedAsConnected() {
        assertThat(ConnectionState.CONNECTED.isConnected()).isTrue();
        assertThat(ConnectionState.CONNECTING.isConnected()).isFalse();
        assertThat(ConnectionState.DISCONNECTED.isConnected()).isFalse();
        assertThat(ConnectionState.error("x").isConnected()).isFalse();
    }

    @Test
    void shouldDefaultErrorMessage() {
        ConnectionState.Error error = (ConnectionState.Error) ConnectionState.error(null);

        assertThat(error.message()).isEqualTo("Unknown error");
    }

    @Test
    void shouldExposeSnapshotShortcuts() {
        ServerSnapshot snapshot =
                new ServerSnapshot(
                        ServerDescriptor.of("s1", "http://localhost", TransportKind.SSE),
                        ConnectionState.CONNECTED);

        assertThat(snapshot.serverId()).isEqualTo("s1");
        assertThat(snapshot.isConnected()).isTrue();
    }
}
