package decentralabs.sso.service.registration;

import decentralabs.sso.exception.AccountRegistrationException;
import java.util.List;

/**
 * Creates local accounts.
 */
public interface AccountRegistrar {

    /**
     * Registers a new account.
     *
     * @param localpart          localpart of the new user id
     * @param defaultDisplayName display name, or null to use the localpart
     * @param bindEmails         e-mail addresses to bind
     * @return full user id of the new account
     * @throws AccountRegistrationException if the account cannot be created
     */
    String registerUser(String localpart, String defaultDisplayName, List<String> bindEmails);
}
