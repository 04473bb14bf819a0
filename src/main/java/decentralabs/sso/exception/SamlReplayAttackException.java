package decentralabs.sso.exception;

/**
 * Exception thrown when a SAML response does not answer any outstanding request
 */
public class SamlReplayAttackException extends SamlAuthenticationException {
    public SamlReplayAttackException(String message) {
        super(message);
    }

    public SamlReplayAttackException(String message, Throwable cause) {
        super(message, cause);
    }
}
