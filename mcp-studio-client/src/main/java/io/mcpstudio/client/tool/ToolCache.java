package io.mcpstudio.client.tool;

import io.mcpstudio.core.tool.ToolDescriptor;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// Volatile cache of the tool lists of connected servers.
///
/// Each entry is an immutable list replaced wholesale, so readers see either the old
/// or the new list. Reads never block and never trigger network I/O.
@ApplicationScoped
public class ToolCache {

    private final Map<String, List<ToolDescriptor>> tools = new ConcurrentHashMap<>();

    /// Returns the cached tools of a server.
    ///
    /// @param serverId server identifier
    /// @return cached tools in server order, empty if nothing is cached
    public List<ToolDescriptor> get(String serverId) {
        return tools.getOrDefault(serverId, List.of());
    }

    /// Replaces the cached tools of a server.
    ///
    /// @param serverId server identifier
    /// @param descriptors complete tool list
    public void replace(String serverId, List<ToolDescriptor> descriptors) {
        tools.put(serverId, List.copyOf(descriptors));
    }

    /// Drops the cached tools of a server.
    ///
    /// @param serverId server identifier
    public void invalidate(String serverId) {
        tools.remove(serverId);
    }

    public void clear() {
        tools.clear();
    }
}
