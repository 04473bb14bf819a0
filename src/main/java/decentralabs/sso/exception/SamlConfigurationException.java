package decentralabs.sso.exception;

/**
 * Invalid SAML mapping configuration. Raised while the application context starts.
 */
public class SamlConfigurationException extends RuntimeException {

    public SamlConfigurationException(String message) {
        super(message);
    }
}
