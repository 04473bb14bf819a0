package decentralabs.sso.service.auth;

import decentralabs.sso.dto.auth.SsoCompletion;
import decentralabs.sso.dto.auth.SsoRequestContext;

/**
 * Finishes an SSO flow once the local user is known.
 */
public interface SsoLoginCompleter {

    /**
     * Completes the SSO stage of an interactive-auth session.
     */
    SsoCompletion completeSsoUiAuth(String userId, String uiAuthSessionId, SsoRequestContext request);

    /**
     * Completes a fresh login and sends the browser back to the client.
     *
     * @param clientRedirectUrl URL the client asked to return to (the relay state)
     */
    SsoCompletion completeSsoLogin(String userId, SsoRequestContext request, String clientRedirectUrl);
}
