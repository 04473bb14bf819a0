package decentralabs.sso.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@ConfigurationProperties(prefix = "saml2")
@Validated
public class SamlSsoProperties {

    /** How long an AuthnRequest stays valid while waiting for the identity provider. */
    @NotNull
    private Duration sessionLifetime = Duration.ofMinutes(5);

    /** Legacy attribute matched against existing accounts that predate external id bindings. Empty disables it. */
    private String grandfatheredMxidSourceAttribute;

    /** Namespace of the external id bindings written by this service. */
    @NotBlank
    private String authProviderId = "saml";

    /** Account store implementation: memory or jdbc. */
    @Pattern(regexp = "memory|jdbc")
    private String accountStore = "memory";

    @Valid
    private UserMappingProvider userMappingProvider = new UserMappingProvider();

    @Valid
    private LoginToken loginToken = new LoginToken();

    public long getSessionLifetimeMs() {
        return sessionLifetime.toMillis();
    }

    public boolean hasGrandfatheredMxidSourceAttribute() {
        return grandfatheredMxidSourceAttribute != null && !grandfatheredMxidSourceAttribute.isBlank();
    }

    @Data
    public static class UserMappingProvider {

        /** Options handed to the mapping provider, e.g. mxid_source_attribute and mxid_mapping. */
        private Map<String, String> config = new LinkedHashMap<>();
    }

    @Data
    public static class LoginToken {

        /** HMAC secret for login tokens; at least 32 bytes. A random secret is generated when empty. */
        private String secret;

        /** Lifetime of a login token. */
        @NotNull
        private Duration ttl = Duration.ofMinutes(2);
    }
}
