package decentralabs.sso.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outgoing AuthnRequest prepared by the SAML library.
 *
 * @param requestId id the identity provider echoes back as InResponseTo
 * @param headers   HTTP headers the browser must receive, in order
 */
public record AuthnRequestInfo(String requestId, List<Map.Entry<String, String>> headers) {

    public AuthnRequestInfo {
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public Optional<String> header(String name) {
        return headers.stream()
            .filter(header -> name.equals(header.getKey()))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
