package decentralabs.sso.service.auth;

import decentralabs.sso.config.SamlSsoProperties;
import decentralabs.sso.config.ServerProperties;
import decentralabs.sso.exception.MxidMappingExhaustedException;
import decentralabs.sso.exception.SamlMappingException;
import decentralabs.sso.exception.SamlMissingAttributesException;
import decentralabs.sso.model.LocalAccount;
import decentralabs.sso.model.SamlAuthnResponse;
import decentralabs.sso.model.UserAttributes;
import decentralabs.sso.model.UserId;
import decentralabs.sso.service.mapping.SamlUserMappingProvider;
import decentralabs.sso.service.persistence.AccountStore;
import decentralabs.sso.service.registration.AccountRegistrar;
import decentralabs.sso.util.Linearizer;
import decentralabs.sso.util.LogSanitizer;
import decentralabs.sso.util.MxidLocalpartNormalizer;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves a verified SAML response to exactly one local user, registering one if needed.
 *
 * Lookup order:
 * <ol>
 *   <li>existing external id binding</li>
 *   <li>legacy account matched through the grandfathered attribute (the binding is created on the fly)</li>
 *   <li>new account under the first free localpart the mapping provider proposes</li>
 * </ol>
 * The whole sequence holds the mapping lock for the auth provider, so two responses for the
 * same remote user cannot both miss the binding and both register.
 */
@Service
@Slf4j
public class SamlIdentityResolver {

    static final int MAX_LOCALPART_ATTEMPTS = 1000;

    private final SamlUserMappingProvider mappingProvider;
    private final AccountStore accountStore;
    private final AccountRegistrar accountRegistrar;
    private final Linearizer mappingLock;
    private final SamlSsoProperties properties;
    private final ServerProperties serverProperties;

    @Autowired
    public SamlIdentityResolver(
            SamlUserMappingProvider mappingProvider,
            AccountStore accountStore,
            AccountRegistrar accountRegistrar,
            Linearizer samlMappingLock,
            SamlSsoProperties properties,
            ServerProperties serverProperties) {
        this.mappingProvider = mappingProvider;
        this.accountStore = accountStore;
        this.accountRegistrar = accountRegistrar;
        this.mappingLock = samlMappingLock;
        this.properties = properties;
        this.serverProperties = serverProperties;
    }

    /**
     * Maps the response to a local user id.
     *
     * @param response          verified SAML response
     * @param clientRedirectUrl relay state of the login, handed to the mapping provider
     * @return full local user id
     * @throws SamlMissingAttributesException if the response lacks an attribute the provider needs
     * @throws MxidMappingExhaustedException  if every localpart candidate is taken
     */
    public String mapSamlResponseToUser(SamlAuthnResponse response, String clientRedirectUrl)
            throws SamlMissingAttributesException {
        String authProviderId = properties.getAuthProviderId();

        try (Linearizer.Lane lane = mappingLock.queue(authProviderId)) {
            String remoteUserId = mappingProvider.getRemoteUserId(response, clientRedirectUrl);
            if (remoteUserId == null || remoteUserId.isEmpty()) {
                throw new SamlMappingException("Failed to extract remote user id from SAML response");
            }

            // first of all, check if we already have a mapping for this user
            log.info("Looking for existing mapping for user {}",
                LogSanitizer.maskExternalId(authProviderId, remoteUserId));
            Optional<String> registered = accountStore.getUserByExternalId(authProviderId, remoteUserId);
            if (registered.isPresent()) {
                log.info("Found existing mapping {}", registered.get());
                return registered.get();
            }

            Optional<String> grandfathered = findGrandfatheredUser(response, authProviderId, remoteUserId);
            if (grandfathered.isPresent()) {
                return grandfathered.get();
            }

            UserAttributes attributes = allocateLocalpart(response, clientRedirectUrl)
                .orElseThrow(() -> {
                    log.error("Unable to generate a free localpart for {} in {} attempts",
                        LogSanitizer.maskExternalId(authProviderId, remoteUserId), MAX_LOCALPART_ATTEMPTS);
                    return new MxidMappingExhaustedException(remoteUserId, MAX_LOCALPART_ATTEMPTS);
                });
            log.info("Mapped SAML user to local part {}", attributes.mxidLocalpart());

            String userId = accountRegistrar.registerUser(
                attributes.mxidLocalpart(),
                attributes.displayName(),
                attributes.emails()
            );
            recordBinding(authProviderId, remoteUserId, userId);
            return userId;
        }
    }

    /**
     * Adopts an account created before external id bindings existed, if the grandfathered
     * attribute matches exactly one account.
     */
    private Optional<String> findGrandfatheredUser(SamlAuthnResponse response, String authProviderId, String remoteUserId) {
        if (!properties.hasGrandfatheredMxidSourceAttribute()) {
            return Optional.empty();
        }
        String attribute = properties.getGrandfatheredMxidSourceAttribute();
        Optional<String> value = response.firstValue(attribute);
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String candidate = toUserId(MxidLocalpartNormalizer.hexEncode(value.get()));
        log.info("Looking for existing account based on mapped {} {}", attribute, candidate);

        Map<String, LocalAccount> users = accountStore.getUsersByIdCaseInsensitive(candidate);
        if (users.isEmpty()) {
            return Optional.empty();
        }
        if (users.size() > 1) {
            log.warn("Mapped {} {} matches {} accounts {}; not grandfathering",
                attribute, candidate, users.size(), users.keySet());
            return Optional.empty();
        }

        String registeredUserId = users.keySet().iterator().next();
        log.info("Grandfathering mapping to {}", registeredUserId);
        accountStore.recordUserExternalId(authProviderId, remoteUserId, registeredUserId);
        return Optional.of(registeredUserId);
    }

    /**
     * Asks the mapping provider for candidates until one names a free user id.
     *
     * @return attributes of the first free candidate, or empty once {@link #MAX_LOCALPART_ATTEMPTS} are used up
     */
    private Optional<UserAttributes> allocateLocalpart(SamlAuthnResponse response, String clientRedirectUrl)
            throws SamlMissingAttributesException {
        for (int attempt = 0; attempt < MAX_LOCALPART_ATTEMPTS; attempt++) {
            UserAttributes attributes = mappingProvider.samlResponseToUserAttributes(response, attempt, clientRedirectUrl);
            log.debug("Retrieved SAML attributes from user mapping provider: {} (attempt {})", attributes, attempt);

            String localpart = attributes == null ? null : attributes.mxidLocalpart();
            if (localpart == null || localpart.isEmpty()) {
                throw new SamlMappingException(
                    "Error parsing SAML2 response: SAML mapping provider plugin did not return a mxid_localpart value");
            }

            if (accountStore.getUsersByIdCaseInsensitive(toUserId(localpart)).isEmpty()) {
                return Optional.of(attributes);
            }
        }
        return Optional.empty();
    }

    private void recordBinding(String authProviderId, String remoteUserId, String userId) {
        try {
            accountStore.recordUserExternalId(authProviderId, remoteUserId, userId);
        } catch (RuntimeException e) {
            // the account exists now but nothing points at it
            log.error("Registered {} but could not bind it to {}; the account is orphaned",
                userId, LogSanitizer.maskExternalId(authProviderId, remoteUserId), e);
            throw e;
        }
    }

    private String toUserId(String localpart) {
        return new UserId(localpart, serverProperties.getName()).toString();
    }
}
