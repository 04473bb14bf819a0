package decentralabs.sso.service.registration;

import decentralabs.sso.config.ServerProperties;
import decentralabs.sso.exception.AccountRegistrationException;
import decentralabs.sso.model.LocalAccount;
import decentralabs.sso.model.UserId;
import decentralabs.sso.service.persistence.AccountStore;
import decentralabs.sso.util.LogSanitizer;
import decentralabs.sso.util.MxidLocalpartNormalizer;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Registers accounts directly in the {@link AccountStore}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalAccountRegistrar implements AccountRegistrar {

    static final int MAX_USER_ID_LENGTH = 255;

    private final AccountStore accountStore;
    private final ServerProperties serverProperties;
    private final Clock clock;

    @Override
    public String registerUser(String localpart, String defaultDisplayName, List<String> bindEmails) {
        if (!MxidLocalpartNormalizer.isValidLocalpart(localpart)) {
            throw new AccountRegistrationException(localpart,
                "User ID can only contain characters a-z, 0-9, or '=_-./' and may not start with '_'");
        }
        String userId = new UserId(localpart, serverProperties.getName()).toString();
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new AccountRegistrationException(localpart,
                "User ID may not be longer than " + MAX_USER_ID_LENGTH + " characters");
        }
        if (!accountStore.getUsersByIdCaseInsensitive(userId).isEmpty()) {
            throw new AccountRegistrationException(localpart, "User ID already taken.");
        }

        String displayName = defaultDisplayName != null ? defaultDisplayName : localpart;
        try {
            accountStore.createAccount(new LocalAccount(userId, displayName, bindEmails, clock.millis()));
        } catch (DuplicateKeyException e) {
            throw new AccountRegistrationException(localpart, "User ID already taken.", e);
        } catch (DataAccessException e) {
            throw new AccountRegistrationException(localpart, "Unable to store account: " + e.getMessage(), e);
        }

        log.info("Registered new account {} with {} e-mail address(es)",
            LogSanitizer.sanitize(userId), bindEmails == null ? 0 : bindEmails.size());
        return userId;
    }
}
