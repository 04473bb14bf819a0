package decentralabs.sso.service.mapping;

import decentralabs.sso.exception.SamlConfigurationException;
import decentralabs.sso.util.MxidLocalpartNormalizer;
import java.util.Arrays;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Localpart normalization policies selectable through {@code mxid_mapping}.
 */
public enum MxidMapper {

    HEXENCODE("hexencode", MxidLocalpartNormalizer::hexEncode),
    DOTREPLACE("dotreplace", MxidLocalpartNormalizer::dotReplace);

    private final String configName;
    private final UnaryOperator<String> mapping;

    MxidMapper(String configName, UnaryOperator<String> mapping) {
        this.configName = configName;
        this.mapping = mapping;
    }

    public String map(String username) {
        return mapping.apply(username);
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @throws SamlConfigurationException if no policy has that name
     */
    public static MxidMapper fromConfigName(String name) {
        return Arrays.stream(values())
            .filter(mapper -> mapper.configName.equals(name))
            .findFirst()
            .orElseThrow(() -> new SamlConfigurationException(
                "saml2.user-mapping-provider.config: '" + name + "' is not a valid mxid_mapping value. Expected one of "
                    + Arrays.stream(values()).map(MxidMapper::getConfigName).collect(Collectors.joining(", "))));
    }
}
