package io.mcpstudio.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.lang.reflect.Method;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class McpClientSettingsTest {

    @Nested
    class Defaults {

        @Test
        void shouldUseDocumentedDefaults() {
            McpClientSettings settings = McpClientSettings.defaults();

            assertThat(settings.connectTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(settings.callTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(settings.probeTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(settings.heartbeatInterval()).isEqualTo(Duration.ofSeconds(10));
            assertThat(settings.heartbeatMaxFailures()).isEqualTo(3);
            assertThat(settings.autoReconnect()).isFalse();
            assertThat(settings.refreshToolsOnConnect()).isTrue();
            assertThat(settings.clientName()).isEqualTo("MCP Studio");
            assertThat(settings.clientVersion()).isEqualTo("0.1.0");
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldClampHeartbeatIntervalToBounds() {
            assertThat(
                            McpClientSettings.builder()
                                    .heartbeatInterval(Duration.ofSeconds(1))
                                    .build()
                                    .heartbeatInterval())
                    .isEqualTo(Duration.ofSeconds(5));
            assertThat(
                            McpClientSettings.builder()
                                    .heartbeatInterval(Duration.ofMinutes(10))
                                    .build()
                                    .heartbeatInterval())
                    .isEqualTo(Duration.ofSeconds(300));
        }

        @Test
        void shouldRejectNonPositiveTimeouts() {
            assertThatThrownBy(() -> McpClientSettings.builder().callTimeout(Duration.ZERO).build())
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("callTimeout");
        }

        @Test
        void shouldRejectZeroFailureThreshold() {
            assertThatThrownBy(() -> McpClientSettings.builder().heartbeatMaxFailures(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRoundTripThroughBuilder() {
            McpClientSettings settings =
                    McpClientSettings.builder().autoReconnect(true).clientName("Probe").build();

            assertThat(settings.toBuilder().build()).isEqualTo(settings);
        }
    }

    @Nested
    class Producer {

        @Test
        void shouldBindConfiguredValues() {
            McpClientSettingsProducer producer =
                    new McpClientSettingsProducer(
                            Duration.ofSeconds(3),
                            Duration.ofSeconds(4),
                            Duration.ofSeconds(6),
                            Duration.ofSeconds(1),
                            Duration.ofSeconds(2),
                            5,
                            true,
                            Duration.ofSeconds(7),
                            false,
                            "Client",
                            "9.9",
                            "2024-11-05");

            McpClientSettings settings = producer.settings();

            assertThat(settings.connectTimeout()).isEqualTo(Duration.ofSeconds(3));
            assertThat(settings.heartbeatInterval()).isEqualTo(Duration.ofSeconds(5));
            assertThat(settings.heartbeatMaxFailures()).isEqualTo(5);
            assertThat(settings.autoReconnect()).isTrue();
            assertThat(settings.protocolVersion()).isEqualTo("2024-11-05");
        }

        @Test
        void shouldProduceHttp11ClientWithoutProxy() {
            McpClientSettingsProducer producer =
                    new McpClientSettingsProducer(
                            Duration.ofSeconds(3),
                            Duration.ofSeconds(30),
                            Duration.ofSeconds(30),
                            Duration.ofSeconds(5),
                            Duration.ofSeconds(10),
                            3,
                            false,
                            Duration.ofSeconds(10),
                            true,
                            "MCP Studio",
                            "0.1.0",
                            "2025-03-26");

            HttpClient client = producer.httpClient();

            assertThat(client.version()).isEqualTo(HttpClient.Version.HTTP_1_1);
            assertThat(client.connectTimeout()).contains(Duration.ofSeconds(3));
            assertThat(client.proxy()).isPresent();
        }

        @Test
        void shouldProduceUnproxiedSingletons() {
            List<Method> producers =
                    Arrays.stream(McpClientSettingsProducer.class.getDeclaredMethods())
                            .filter(method -> method.isAnnotationPresent(Produces.class))
                            .toList();

            // a record type cannot sit behind a normal-scoped client proxy
            assertThat(producers)
                    .extracting(Method::getName)
                    .containsExactlyInAnyOrder("settings", "httpClient", "objectMapper");
            assertThat(producers)
                    .allSatisfy(
                            method -> {
                                assertThat(method.isAnnotationPresent(Singleton.class)).isTrue();
                                assertThat(method.isAnnotationPresent(ApplicationScoped.class))
                                        .isFalse();
                            });
        }
    }
}
