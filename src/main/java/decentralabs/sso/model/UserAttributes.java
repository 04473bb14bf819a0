package decentralabs.sso.model;

import java.util.List;

/**
 * Attributes for a new local account, produced by a mapping provider for one attempt.
 *
 * @param mxidLocalpart localpart candidate; required
 * @param displayName   display name, may be null
 * @param emails        e-mail addresses to bind to the account
 */
public record UserAttributes(String mxidLocalpart, String displayName, List<String> emails) {

    public UserAttributes {
        emails = emails == null ? List.of() : List.copyOf(emails);
    }
}
