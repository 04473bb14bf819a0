package decentralabs.sso.service.auth;

import decentralabs.sso.dto.auth.SsoCompletion;
import decentralabs.sso.dto.auth.SsoRequestContext;
import decentralabs.sso.util.LogSanitizer;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Fresh logins get a login token appended to the client's redirect URL; interactive-auth
 * sessions get their SSO stage marked complete and a confirmation page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultSsoLoginCompleter implements SsoLoginCompleter {

    static final String LOGIN_TOKEN_PARAM = "loginToken";

    private final LoginTokenService loginTokenService;
    private final UiAuthSessionRegistry uiAuthSessionRegistry;

    @Override
    public SsoCompletion completeSsoUiAuth(String userId, String uiAuthSessionId, SsoRequestContext request) {
        uiAuthSessionRegistry.markStageComplete(uiAuthSessionId, userId);
        String html = "<html><head><title>Authentication successful</title></head><body>"
            + "<p>Thank you, " + HtmlUtils.htmlEscape(userId) + ".</p>"
            + "<p>You may now close this window and return to the application.</p>"
            + "</body></html>";
        return SsoCompletion.page(userId, html);
    }

    @Override
    public SsoCompletion completeSsoLogin(String userId, SsoRequestContext request, String clientRedirectUrl) {
        String loginToken = loginTokenService.generateLoginToken(userId);
        String redirectUri = appendLoginToken(clientRedirectUrl, loginToken);
        log.info("SSO login completed for {} from {}",
            LogSanitizer.sanitize(userId),
            LogSanitizer.sanitizeOrDefault(request == null ? null : request.clientIp(), "unknown"));
        return SsoCompletion.redirect(userId, redirectUri);
    }

    /**
     * Appends the login token to the client's URL, leaving the client's own components as sent.
     */
    static String appendLoginToken(String clientRedirectUrl, String loginToken) {
        try {
            return UriComponentsBuilder.fromUriString(clientRedirectUrl)
                .queryParam(LOGIN_TOKEN_PARAM, UriUtils.encodeQueryParam(loginToken, StandardCharsets.UTF_8))
                .build(true)
                .toUriString();
        } catch (IllegalArgumentException e) {
            // the client sent raw characters that are illegal in a URI; encode them once
            return UriComponentsBuilder.fromUriString(clientRedirectUrl)
                .queryParam(LOGIN_TOKEN_PARAM, loginToken)
                .build()
                .encode()
                .toUriString();
        }
    }
}
