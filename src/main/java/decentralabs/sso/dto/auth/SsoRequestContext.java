package decentralabs.sso.dto.auth;

/**
 * Details of the browser request that finished an SSO flow.
 *
 * @param clientIp  remote address of the browser
 * @param userAgent User-Agent header, may be null
 */
public record SsoRequestContext(String clientIp, String userAgent) {
}
