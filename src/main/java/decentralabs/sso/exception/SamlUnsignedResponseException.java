package decentralabs.sso.exception;

/**
 * Exception thrown when a SAML response carries no signature
 */
public class SamlUnsignedResponseException extends SamlAuthenticationException {
    public SamlUnsignedResponseException(String message) {
        super(message);
    }

    public SamlUnsignedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
