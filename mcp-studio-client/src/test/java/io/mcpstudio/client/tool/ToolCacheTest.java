package io.mcpstudio.client.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mcpstudio.core.tool.ToolDescriptor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToolCacheTest {

    private ToolCache cache;

    @BeforeEach
    void setUp() {
        cache = new ToolCache();
    }

    @Test
    void shouldReturnEmptyListForUnknownServer() {
        assertThat(cache.get("unknown")).isEmpty();
    }

    @Test
    void shouldReplaceEntryWholesale() {
        cache.replace("s1", List.of(ToolDescriptor.of("a", null), ToolDescriptor.of("b", null)));
        cache.replace("s1", List.of(ToolDescriptor.of("c", null)));

        assertThat(cache.get("s1")).extracting(ToolDescriptor::name).containsExactly("c");
    }

    @Test
    void shouldStoreImmutableCopy() {
        List<ToolDescriptor> source = new ArrayList<>(List.of(ToolDescriptor.of("a", null)));
        cache.replace("s1", source);
        source.add(ToolDescriptor.of("b", null));

        assertThat(cache.get("s1")).hasSize(1);
        assertThatThrownBy(() -> cache.get("s1").add(ToolDescriptor.of("x", null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldInvalidateSingleServer() {
        cache.replace("s1", List.of(ToolDescriptor.of("a", null)));
        cache.replace("s2", List.of(ToolDescriptor.of("b", null)));

        cache.invalidate("s1");

        assertThat(cache.get("s1")).isEmpty();
        assertThat(cache.get("s2")).hasSize(1);
    }
}
