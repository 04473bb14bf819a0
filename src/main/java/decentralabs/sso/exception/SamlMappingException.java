package decentralabs.sso.exception;

/**
 * Exception thrown when the user mapping provider returns unusable output
 */
public class SamlMappingException extends RuntimeException {

    public SamlMappingException(String message) {
        super(message);
    }
}
