package decentralabs.sso.exception;

/**
 * Exception thrown when a local account cannot be registered
 */
public class AccountRegistrationException extends RuntimeException {

    private final String localpart;

    public AccountRegistrationException(String localpart, String message) {
        super(message);
        this.localpart = localpart;
    }

    public AccountRegistrationException(String localpart, String message, Throwable cause) {
        super(message, cause);
        this.localpart = localpart;
    }

    public String getLocalpart() {
        return localpart;
    }
}
