package decentralabs.sso.service.mapping;

import java.util.Objects;

/**
 * Parsed configuration of {@link DefaultSamlMappingProvider}.
 *
 * @param mxidSourceAttribute attribute whose first value seeds the localpart
 * @param mxidMapper          normalization policy applied to that value
 */
public record DefaultSamlMappingConfig(String mxidSourceAttribute, MxidMapper mxidMapper) {

    public DefaultSamlMappingConfig {
        Objects.requireNonNull(mxidSourceAttribute, "mxidSourceAttribute");
        Objects.requireNonNull(mxidMapper, "mxidMapper");
    }
}
