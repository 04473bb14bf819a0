package decentralabs.sso.model;

import java.util.Objects;

/**
 * A fully qualified local user id of the form {@code @localpart:domain}.
 */
public record UserId(String localpart, String domain) {

    public UserId {
        Objects.requireNonNull(localpart, "localpart");
        Objects.requireNonNull(domain, "domain");
    }

    @Override
    public String toString() {
        return "@" + localpart + ":" + domain;
    }
}
