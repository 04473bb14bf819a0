package decentralabs.sso.service.persistence;

import decentralabs.sso.model.LocalAccount;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store of local accounts and their external identity bindings.
 */
public interface AccountStore {

    /**
     * @return local user id bound to {@code (authProvider, externalId)}, if any
     */
    Optional<String> getUserByExternalId(String authProvider, String externalId);

    /**
     * @return accounts whose user id equals {@code userId} ignoring case, keyed by their exact user id
     */
    Map<String, LocalAccount> getUsersByIdCaseInsensitive(String userId);

    /**
     * Binds an external identity to a local account.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the external identity is already bound
     */
    void recordUserExternalId(String authProvider, String externalId, String userId);

    /**
     * Stores a new account.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the user id is taken
     */
    void createAccount(LocalAccount account);

    /**
     * @return short name of the backing store, reported by the health endpoint
     */
    String getStoreType();
}
