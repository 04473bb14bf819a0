package decentralabs.sso.exception;

/**
 * Exception thrown when no free localpart was found within the attempt limit.
 * Points at a broken mapping provider rather than at the user.
 */
public class MxidMappingExhaustedException extends RuntimeException {

    private final String remoteUserId;
    private final int attempts;

    public MxidMappingExhaustedException(String remoteUserId, int attempts) {
        super("Unable to generate a Matrix ID from the SAML response");
        this.remoteUserId = remoteUserId;
        this.attempts = attempts;
    }

    public String getRemoteUserId() {
        return remoteUserId;
    }

    public int getAttempts() {
        return attempts;
    }
}
