package decentralabs.sso.exception;

/**
 * Base exception for SAML responses rejected as client errors
 */
public abstract class SamlAuthenticationException extends Exception {
    public SamlAuthenticationException(String message) {
        super(message);
    }

    public SamlAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
