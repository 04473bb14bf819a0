package decentralabs.sso.dto.auth;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What the browser receives once an SSO flow is complete: either a redirect or an HTML page.
 */
@Getter
@AllArgsConstructor
public class SsoCompletion {

    private final String userId;
    private final String redirectUri;
    private final String htmlBody;

    public static SsoCompletion redirect(String userId, String redirectUri) {
        return new SsoCompletion(userId, redirectUri, null);
    }

    public static SsoCompletion page(String userId, String htmlBody) {
        return new SsoCompletion(userId, null, htmlBody);
    }

    public boolean isRedirect() {
        return redirectUri != null;
    }
}
