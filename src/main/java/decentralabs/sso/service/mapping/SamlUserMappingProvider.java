package decentralabs.sso.service.mapping;

import decentralabs.sso.exception.SamlMissingAttributesException;
import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.model.SamlAuthnResponse;
import decentralabs.sso.model.UserAttributes;

/**
 * Maps a verified SAML response onto a local user.
 *
 * Implementations must be deterministic: the same response and attempt number
 * always yield the same attributes.
 */
public interface SamlUserMappingProvider {

    /**
     * Extracts the stable id the identity provider assigns to the user.
     *
     * @throws SamlMissingAttributesException if the response lacks the id attribute
     */
    String getRemoteUserId(SamlAuthnResponse response, String clientRedirectUrl)
        throws SamlMissingAttributesException;

    /**
     * Proposes attributes for a new account.
     *
     * @param failures number of earlier proposals for this response whose localpart was taken
     * @throws SamlMissingAttributesException if the response lacks the source attribute
     */
    UserAttributes samlResponseToUserAttributes(SamlAuthnResponse response, int failures, String clientRedirectUrl)
        throws SamlMissingAttributesException;

    /**
     * @return attributes the provider needs, and those it uses if available
     */
    SamlAttributeRequirements getSamlAttributes();
}
