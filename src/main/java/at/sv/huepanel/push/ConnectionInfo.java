package at.sv.huepanel.push;

/**
 * @param bridgeAddress null while the connection is not yet authenticated
 */
public record ConnectionInfo(String id, String bridgeAddress, boolean demo, ConnectionState state, long ageSeconds,
                             long secondsSinceLastPong, boolean busy, int pendingMessages) {
}
