package decentralabs.sso.service.auth;

import decentralabs.sso.config.SamlSsoProperties;
import decentralabs.sso.dto.auth.SsoCompletion;
import decentralabs.sso.dto.auth.SsoRequestContext;
import decentralabs.sso.exception.SamlAuthenticationException;
import decentralabs.sso.exception.SamlMalformedResponseException;
import decentralabs.sso.exception.SamlUnsignedResponseException;
import decentralabs.sso.model.AuthnRequestInfo;
import decentralabs.sso.model.PendingSamlSession;
import decentralabs.sso.model.SamlAuthnResponse;
import decentralabs.sso.saml.Saml2Client;
import decentralabs.sso.service.session.PendingSessionStore;
import decentralabs.sso.util.LogSanitizer;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives the SAML2 SSO flow: redirect to the identity provider, then map the response
 * to a local user and complete the login.
 */
@Service
@Slf4j
public class SamlHandler {

    static final String LOCATION_HEADER = "Location";

    // log collectors cap the length of a single field
    static final int ASSERTION_LOG_CHUNK = 10000;

    @Autowired
    private Saml2Client samlClient;

    @Autowired
    private PendingSessionStore pendingSessions;

    @Autowired
    private SamlIdentityResolver identityResolver;

    @Autowired
    private SsoLoginCompleter loginCompleter;

    @Autowired
    private SamlSsoProperties properties;

    @Autowired
    private Clock clock;

    /**
     * Starts a login by building an AuthnRequest.
     *
     * @param clientRedirectUrl URL to send the browser to when everything is done
     * @param uiAuthSessionId   interactive-auth session this login completes, or null for a plain login
     * @return URL of the identity provider to redirect the browser to
     */
    public String handleRedirectRequest(String clientRedirectUrl, String uiAuthSessionId) {
        AuthnRequestInfo info = samlClient.prepareForAuthenticate(clientRedirectUrl);

        pendingSessions.create(info.requestId(), clock.millis(), uiAuthSessionId);

        return info.header(LOCATION_HEADER)
            .orElseThrow(() -> new IllegalStateException("prepare_for_authenticate didn't return a Location header"));
    }

    /**
     * Handles a response posted back by the identity provider.
     *
     * @param samlResponse base64 SAMLResponse form value
     * @param relayState   RelayState form value, the client's redirect URL
     * @param request      browser request details
     * @return what to send the browser
     * @throws SamlAuthenticationException if the response is rejected
     */
    public SsoCompletion handleSamlResponse(String samlResponse, String relayState, SsoRequestContext request)
            throws SamlAuthenticationException {
        // expire outstanding sessions before the library checks the response against them
        int expired = pendingSessions.sweepExpired(clock.millis(), properties.getSessionLifetimeMs());
        if (expired > 0) {
            log.debug("Expired {} outstanding SAML session(s)", expired);
        }

        SamlAuthnResponse response = parseResponse(samlResponse);

        Optional<PendingSamlSession> currentSession = pendingSessions.popIfPresent(response.inResponseTo());
        if (currentSession.isEmpty()) {
            log.warn("No outstanding SAML request for InResponseTo {}",
                LogSanitizer.sanitize(response.inResponseTo()));
        }

        String userId = identityResolver.mapSamlResponseToUser(response, relayState);

        String uiAuthSessionId = currentSession.map(PendingSamlSession::uiAuthSessionId).orElse(null);
        if (uiAuthSessionId != null) {
            return loginCompleter.completeSsoUiAuth(userId, uiAuthSessionId, request);
        }
        return loginCompleter.completeSsoLogin(userId, request, relayState);
    }

    /**
     * @return number of AuthnRequests awaiting a response
     */
    public int getOutstandingRequestCount() {
        return pendingSessions.size();
    }

    private SamlAuthnResponse parseResponse(String samlResponse) throws SamlAuthenticationException {
        SamlAuthnResponse response;
        try {
            response = samlClient.parseAuthnRequestResponse(samlResponse, pendingSessions.outstandingRequestIds());
        } catch (SamlAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SamlMalformedResponseException("Unable to parse SAML2 response: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new SamlMalformedResponseException("Unable to parse SAML2 response: no response");
        }
        if (!response.signed()) {
            throw new SamlUnsignedResponseException("SAML2 response was not signed");
        }

        log.debug("SAML2 response from {} in response to {}",
            LogSanitizer.sanitize(response.issuer()), LogSanitizer.sanitize(response.inResponseTo()));
        for (String assertion : response.assertions()) {
            logAssertion(assertion);
        }
        log.info("SAML2 mapped attributes: {}", response.attributes().keySet());
        return response;
    }

    private void logAssertion(String assertion) {
        int count = 0;
        for (int start = 0; start < assertion.length(); start += ASSERTION_LOG_CHUNK) {
            String part = assertion.substring(start, Math.min(assertion.length(), start + ASSERTION_LOG_CHUNK));
            log.info("SAML2 assertion: {}{}", count > 0 ? "(" + count + ")..." : "", part);
            count++;
        }
    }
}
