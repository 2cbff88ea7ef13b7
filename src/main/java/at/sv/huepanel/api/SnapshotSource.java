package at.sv.huepanel.api;

import at.sv.huepanel.snapshot.Snapshot;

public interface SnapshotSource {
    /**
     * Returns the current full state of the given bridge. Fast-changing resources (light on/off, motion) always
     * reflect the latest call; slow-changing resources may be served from a short-lived cache.
     *
     * @param bridgeAddress the host of the bridge, without scheme
     * @param credential    the application key for the bridge
     * @return the current snapshot. Not null.
     * @throws BridgeConnectionFailure     if the bridge could not be reached
     * @throws BridgeAuthenticationFailure if the bridge rejected the credential
     * @throws ApiFailure                  if the bridge returned an error or an unparseable response
     */
    Snapshot getSnapshot(String bridgeAddress, String credential);
}
