package at.sv.huepanel.session;

public final class MissingCredentialException extends RuntimeException {
    public MissingCredentialException(String bridgeAddress) {
        super("No credential stored for bridge '" + bridgeAddress + "'. Pair with the bridge first.");
    }
}
