package at.sv.huepanel.session;

import java.util.Optional;

/**
 * Maps a bridge address to the credential used to talk to it, independent of any client session. There is at most
 * one credential per bridge address; storing a new one replaces the old one.
 */
public interface CredentialStore {

    Optional<String> get(String bridgeAddress);

    boolean has(String bridgeAddress);

    void put(String bridgeAddress, String credential);

    /**
     * @return true if a credential was stored for the bridge
     */
    boolean remove(String bridgeAddress);

    /**
     * @return the first known bridge address, for single bridge setups
     */
    Optional<String> getDefaultBridgeAddress();
}
