package decentralabs.sso.service.mapping;

import decentralabs.sso.exception.SamlConfigurationException;
import decentralabs.sso.exception.SamlMissingAttributesException;
import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.model.SamlAuthnResponse;
import decentralabs.sso.model.UserAttributes;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Default mapping provider.
 *
 * The remote user id is the first {@code uid} value. The localpart is the configured
 * source attribute run through the configured {@link MxidMapper}, with the failure
 * count appended after the first collision ({@code alice}, {@code alice1}, {@code alice2}, ...).
 */
@Slf4j
public class DefaultSamlMappingProvider implements SamlUserMappingProvider {

    public static final String REMOTE_USER_ID_ATTRIBUTE = "uid";
    public static final String DISPLAY_NAME_ATTRIBUTE = "displayName";
    public static final String EMAIL_ATTRIBUTE = "email";

    static final String DEFAULT_MXID_SOURCE_ATTRIBUTE = "uid";
    static final String DEFAULT_MXID_MAPPING = "hexencode";

    private final String mxidSourceAttribute;
    private final MxidMapper mxidMapper;

    public DefaultSamlMappingProvider(DefaultSamlMappingConfig config) {
        this.mxidSourceAttribute = config.mxidSourceAttribute();
        this.mxidMapper = config.mxidMapper();
    }

    @Override
    public String getRemoteUserId(SamlAuthnResponse response, String clientRedirectUrl)
            throws SamlMissingAttributesException {
        return response.firstValue(REMOTE_USER_ID_ATTRIBUTE).orElseThrow(() -> {
            log.warn("SAML2 response lacks a '{}' attestation", REMOTE_USER_ID_ATTRIBUTE);
            return new SamlMissingAttributesException("'" + REMOTE_USER_ID_ATTRIBUTE + "' not in SAML2 response");
        });
    }

    @Override
    public UserAttributes samlResponseToUserAttributes(SamlAuthnResponse response, int failures, String clientRedirectUrl)
            throws SamlMissingAttributesException {
        String mxidSource = response.firstValue(mxidSourceAttribute).orElseThrow(() -> {
            log.warn("SAML2 response lacks a '{}' attestation", mxidSourceAttribute);
            return new SamlMissingAttributesException(mxidSourceAttribute + " not in SAML2 response");
        });

        String baseLocalpart = mxidMapper.map(mxidSource);
        String localpart = failures > 0 ? baseLocalpart + failures : baseLocalpart;

        // null display name: the registrar falls back to the localpart
        String displayName = response.firstValue(DISPLAY_NAME_ATTRIBUTE).orElse(null);
        List<String> emails = response.values(EMAIL_ATTRIBUTE);

        return new UserAttributes(localpart, displayName, emails);
    }

    @Override
    public SamlAttributeRequirements getSamlAttributes() {
        return getSamlAttributes(new DefaultSamlMappingConfig(mxidSourceAttribute, mxidMapper));
    }

    /**
     * Parses the provider's configuration block.
     *
     * Recognised keys: {@code mxid_source_attribute} (default {@code uid}) and
     * {@code mxid_mapping} ({@code hexencode} or {@code dotreplace}, default {@code hexencode}).
     *
     * @throws SamlConfigurationException if {@code mxid_mapping} names no known policy
     */
    public static DefaultSamlMappingConfig parseConfig(Map<String, ?> config) {
        Map<String, ?> options = config == null ? Map.of() : config;
        String sourceAttribute = stringOption(options, "mxid_source_attribute", DEFAULT_MXID_SOURCE_ATTRIBUTE);
        String mappingType = stringOption(options, "mxid_mapping", DEFAULT_MXID_MAPPING);
        return new DefaultSamlMappingConfig(sourceAttribute, MxidMapper.fromConfigName(mappingType));
    }

    public static SamlAttributeRequirements getSamlAttributes(DefaultSamlMappingConfig config) {
        Set<String> required = new LinkedHashSet<>();
        required.add(REMOTE_USER_ID_ATTRIBUTE);
        required.add(config.mxidSourceAttribute());
        return new SamlAttributeRequirements(required, Set.of(DISPLAY_NAME_ATTRIBUTE, EMAIL_ATTRIBUTE));
    }

    private static String stringOption(Map<String, ?> options, String key, String defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString().trim();
    }
}
