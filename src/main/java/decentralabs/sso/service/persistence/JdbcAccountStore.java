package decentralabs.sso.service.persistence;

import decentralabs.sso.model.LocalAccount;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account store backed by the {@code users}, {@code user_emails} and {@code user_external_ids} tables.
 *
 * The primary key of {@code user_external_ids} is {@code (auth_provider, external_id)}; a second
 * binding for the same external id surfaces as {@link org.springframework.dao.DuplicateKeyException}.
 */
@Service
@ConditionalOnProperty(value = "saml2.account-store", havingValue = "jdbc")
@Slf4j
public class JdbcAccountStore implements AccountStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> getUserByExternalId(String authProvider, String externalId) {
        String userId = jdbcTemplate.query(
            "SELECT user_id FROM user_external_ids WHERE auth_provider = ? AND external_id = ?",
            ps -> {
                ps.setString(1, authProvider);
                ps.setString(2, externalId);
            },
            rs -> rs.next() ? rs.getString(1) : null
        );
        return Optional.ofNullable(userId);
    }

    @Override
    public Map<String, LocalAccount> getUsersByIdCaseInsensitive(String userId) {
        List<LocalAccount> rows = new ArrayList<>();
        jdbcTemplate.query(
            "SELECT name, displayname, creation_ts FROM users WHERE LOWER(name) = LOWER(?)",
            ps -> ps.setString(1, userId),
            rs -> {
                rows.add(new LocalAccount(
                    rs.getString("name"),
                    rs.getString("displayname"),
                    List.of(),
                    rs.getLong("creation_ts")
                ));
            }
        );

        // e-mails are loaded once the user rows are closed
        Map<String, LocalAccount> matches = new LinkedHashMap<>();
        for (LocalAccount row : rows) {
            matches.put(row.userId(), new LocalAccount(
                row.userId(), row.displayName(), loadEmails(row.userId()), row.creationTimeMs()));
        }
        return matches;
    }

    @Override
    public void recordUserExternalId(String authProvider, String externalId, String userId) {
        jdbcTemplate.update(
            "INSERT INTO user_external_ids (auth_provider, external_id, user_id) VALUES (?, ?, ?)",
            authProvider,
            externalId,
            userId
        );
    }

    @Override
    @Transactional
    public void createAccount(LocalAccount account) {
        jdbcTemplate.update(
            "INSERT INTO users (name, displayname, creation_ts) VALUES (?, ?, ?)",
            account.userId(),
            account.displayName(),
            account.creationTimeMs()
        );
        for (String email : new LinkedHashSet<>(account.emails())) {
            jdbcTemplate.update(
                "INSERT INTO user_emails (user_id, address, added_at) VALUES (?, ?, ?)",
                account.userId(),
                email,
                account.creationTimeMs()
            );
        }
        log.debug("Account {} stored with {} e-mail address(es)", account.userId(), account.emails().size());
    }

    @Override
    public String getStoreType() {
        return "jdbc";
    }

    private List<String> loadEmails(String userId) {
        List<String> emails = jdbcTemplate.queryForList(
            "SELECT address FROM user_emails WHERE user_id = ? ORDER BY added_at, address",
            String.class,
            userId
        );
        return emails == null ? List.of() : new ArrayList<>(emails);
    }
}
