package decentralabs.sso.service.persistence;

import decentralabs.sso.model.LocalAccount;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Account store kept in memory.
 *
 * Fast, no I/O, lost on restart. Good for development and testing.
 */
@Service
@ConditionalOnProperty(value = "saml2.account-store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryAccountStore implements AccountStore {

    // user id -> account
    private final Map<String, LocalAccount> accounts = new ConcurrentHashMap<>();

    // auth provider + external id -> user id
    private final Map<BindingKey, String> externalIds = new ConcurrentHashMap<>();

    @Override
    public Optional<String> getUserByExternalId(String authProvider, String externalId) {
        return Optional.ofNullable(externalIds.get(new BindingKey(authProvider, externalId)));
    }

    @Override
    public Map<String, LocalAccount> getUsersByIdCaseInsensitive(String userId) {
        String lowered = userId.toLowerCase(Locale.ROOT);
        Map<String, LocalAccount> matches = new LinkedHashMap<>();
        accounts.forEach((id, account) -> {
            if (id.toLowerCase(Locale.ROOT).equals(lowered)) {
                matches.put(id, account);
            }
        });
        return matches;
    }

    @Override
    public void recordUserExternalId(String authProvider, String externalId, String userId) {
        String existing = externalIds.putIfAbsent(new BindingKey(authProvider, externalId), userId);
        if (existing != null) {
            throw new DuplicateKeyException("External id already bound for provider " + authProvider);
        }
    }

    @Override
    public void createAccount(LocalAccount account) {
        LocalAccount existing = accounts.putIfAbsent(account.userId(), account);
        if (existing != null) {
            throw new DuplicateKeyException("User id already taken: " + account.userId());
        }
        log.debug("Account {} stored in memory", account.userId());
    }

    @Override
    public String getStoreType() {
        return "memory";
    }

    int getAccountCount() {
        return accounts.size();
    }

    int getBindingCount() {
        return externalIds.size();
    }

    private record BindingKey(String authProvider, String externalId) {
    }
}
