package decentralabs.sso.controller.auth;

import decentralabs.sso.dto.auth.SamlAttributesResponse;
import decentralabs.sso.dto.auth.SsoCompletion;
import decentralabs.sso.dto.auth.SsoErrorResponse;
import decentralabs.sso.dto.auth.SsoRequestContext;
import decentralabs.sso.exception.*;
import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.service.auth.SamlHandler;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for SAML2 single sign-on endpoints
 */
@RestController
@RequestMapping("/auth/saml2")
@Slf4j
public class SamlSsoController {

    @Autowired
    private SamlHandler samlHandler;

    @Autowired
    private SamlAttributeRequirements attributeRequirements;

    /**
     * Starts a login at the identity provider
     *
     * @param redirectUrl where to send the browser once the login completes
     * @param session     interactive-auth session id, when the login re-authenticates an existing user
     * @return redirect to the identity provider
     */
    @GetMapping("/redirect")
    public ResponseEntity<String> redirect(@RequestParam("redirectUrl") String redirectUrl,
                                           @RequestParam(value = "session", required = false) String session) {
        try {
            String location = samlHandler.handleRedirectRequest(redirectUrl, session);
            return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
        } catch (Exception e) {
            log.error("SAML redirect error", e);
            return ResponseEntity.status(500)
                .contentType(MediaType.APPLICATION_JSON)
                .body(SsoErrorResponse.errorJson("Internal server error"));
        }
    }

    /**
     * Assertion consumer endpoint for the HTTP-POST binding
     *
     * @param samlResponse base64 encoded SAMLResponse
     * @param relayState   the client's redirect URL
     * @return redirect back to the client, or a confirmation page for interactive auth
     */
    @PostMapping(value = "/authn_response", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<String> authnResponse(@RequestParam("SAMLResponse") String samlResponse,
                                                @RequestParam("RelayState") String relayState,
                                                HttpServletRequest request) {
        try {
            SsoRequestContext context = new SsoRequestContext(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
            SsoCompletion completion = samlHandler.handleSamlResponse(samlResponse, relayState, context);
            if (completion.isRedirect()) {
                return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(completion.getRedirectUri())).build();
            }
            return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(completion.getHtmlBody());
        } catch (SamlAuthenticationException e) {
            return jsonError(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (MxidMappingExhaustedException e) {
            log.error("SAML mapping exhausted for remote user after {} attempts", e.getAttempts());
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("SAML response handling error", e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    /**
     * Lists the assertion attributes the mapping provider consumes, for identity provider setup
     */
    @GetMapping("/attributes")
    public ResponseEntity<SamlAttributesResponse> attributes() {
        return ResponseEntity.ok(new SamlAttributesResponse(
            attributeRequirements.required(),
            attributeRequirements.optional()
        ));
    }

    private static ResponseEntity<String> jsonError(HttpStatus status, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(SsoErrorResponse.errorJson(message));
    }
}
