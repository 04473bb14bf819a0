package decentralabs.sso.exception;

/**
 * Exception thrown when a SAML response cannot be parsed
 */
public class SamlMalformedResponseException extends SamlAuthenticationException {
    public SamlMalformedResponseException(String message) {
        super(message);
    }

    public SamlMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
