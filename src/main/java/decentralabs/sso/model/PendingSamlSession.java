package decentralabs.sso.model;

/**
 * An outstanding SAML authentication request.
 *
 * @param requestId          request id assigned by the SAML library to the AuthnRequest
 * @param creationTimeMs     time the request was issued, in milliseconds
 * @param uiAuthSessionId    interactive-auth session this login belongs to, or null for a plain login
 */
public record PendingSamlSession(
    String requestId,
    long creationTimeMs,
    String uiAuthSessionId
) {
}
