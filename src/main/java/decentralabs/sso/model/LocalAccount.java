package decentralabs.sso.model;

import java.util.List;

/**
 * A registered local account.
 *
 * @param userId         full user id, {@code @localpart:server}
 * @param displayName    display name
 * @param emails         bound e-mail addresses
 * @param creationTimeMs registration time in milliseconds
 */
public record LocalAccount(String userId, String displayName, List<String> emails, long creationTimeMs) {

    public LocalAccount {
        emails = emails == null ? List.of() : List.copyOf(emails);
    }
}
