package decentralabs.sso.saml;

import decentralabs.sso.exception.SamlAuthenticationException;
import decentralabs.sso.exception.SamlMalformedResponseException;
import decentralabs.sso.exception.SamlReplayAttackException;
import decentralabs.sso.model.AuthnRequestInfo;
import decentralabs.sso.model.SamlAuthnResponse;
import java.util.Set;

/**
 * Port onto the SAML2 library that builds AuthnRequests and verifies responses.
 * The deployment supplies the implementation as a Spring bean.
 */
public interface Saml2Client {

    /**
     * Builds an AuthnRequest for the HTTP-Redirect binding.
     *
     * @param relayState value the identity provider must echo back
     * @return request id and the headers of the redirect, including {@code Location}
     */
    AuthnRequestInfo prepareForAuthenticate(String relayState);

    /**
     * Parses an HTTP-POST binding response and verifies its signature.
     *
     * @param samlResponse          base64 encoded SAMLResponse form value
     * @param outstandingRequestIds ids of requests still awaiting a response
     * @return the verified response
     * @throws SamlMalformedResponseException if the response cannot be decoded or parsed
     * @throws SamlReplayAttackException      if {@code InResponseTo} names no outstanding request
     *                                        or the assertion was already consumed
     * @throws SamlAuthenticationException    if the response fails verification for another reason
     */
    SamlAuthnResponse parseAuthnRequestResponse(String samlResponse, Set<String> outstandingRequestIds)
        throws SamlAuthenticationException;
}
