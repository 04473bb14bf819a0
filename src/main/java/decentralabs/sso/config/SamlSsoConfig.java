package decentralabs.sso.config;

import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.service.mapping.DefaultSamlMappingConfig;
import decentralabs.sso.service.mapping.DefaultSamlMappingProvider;
import decentralabs.sso.service.mapping.SamlUserMappingProvider;
import decentralabs.sso.service.session.PendingSessionStore;
import decentralabs.sso.util.Linearizer;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the SAML mapping components.
 *
 * An invalid mapping provider configuration fails here, before the application starts serving.
 */
@Configuration
@Slf4j
public class SamlSsoConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DefaultSamlMappingConfig samlMappingConfig(SamlSsoProperties properties) {
        DefaultSamlMappingConfig config =
            DefaultSamlMappingProvider.parseConfig(properties.getUserMappingProvider().getConfig());
        log.info("SAML mapping: localpart from '{}' using {}",
            config.mxidSourceAttribute(), config.mxidMapper().getConfigName());
        return config;
    }

    @Bean
    @ConditionalOnMissingBean(SamlUserMappingProvider.class)
    public SamlUserMappingProvider samlUserMappingProvider(DefaultSamlMappingConfig config) {
        return new DefaultSamlMappingProvider(config);
    }

    @Bean
    public SamlAttributeRequirements samlAttributeRequirements(SamlUserMappingProvider provider) {
        SamlAttributeRequirements requirements = provider.getSamlAttributes();
        log.info("SAML attributes required: {}, optional: {}", requirements.required(), requirements.optional());
        return requirements;
    }

    @Bean
    public PendingSessionStore pendingSessionStore() {
        return new PendingSessionStore();
    }

    @Bean
    public Linearizer samlMappingLock() {
        return new Linearizer("saml_mapping");
    }
}
