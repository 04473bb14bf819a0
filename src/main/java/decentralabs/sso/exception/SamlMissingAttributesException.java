package decentralabs.sso.exception;

/**
 * Exception thrown when a SAML response lacks an attribute the mapping provider requires
 */
public class SamlMissingAttributesException extends SamlAuthenticationException {
    public SamlMissingAttributesException(String message) {
        super(message);
    }

    public SamlMissingAttributesException(String message, Throwable cause) {
        super(message, cause);
    }
}
