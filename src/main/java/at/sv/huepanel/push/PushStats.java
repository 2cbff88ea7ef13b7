package at.sv.huepanel.push;

import java.util.List;
import java.util.Map;

public record PushStats(int totalConnections, Map<String, Integer> connectionsPerBridge,
                        List<ConnectionInfo> connections) {
}
