package decentralabs.sso.service.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import decentralabs.sso.exception.SamlConfigurationException;
import decentralabs.sso.exception.SamlMissingAttributesException;
import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.model.SamlAuthnResponse;
import decentralabs.sso.model.UserAttributes;

class DefaultSamlMappingProviderTest {

    private static final String REDIRECT_URL = "https://client/cb";

    private DefaultSamlMappingProvider provider;

    @BeforeEach
    void setUp() {
        provider = new DefaultSamlMappingProvider(
            DefaultSamlMappingProvider.parseConfig(Map.of("mxid_source_attribute", "username")));
    }

    @Nested
    @DisplayName("Config parsing")
    class ParseConfigTests {

        @Test
        @DisplayName("Should default to uid and hexencode")
        void shouldApplyDefaults() {
            DefaultSamlMappingConfig config = DefaultSamlMappingProvider.parseConfig(Map.of());

            assertThat(config.mxidSourceAttribute()).isEqualTo("uid");
            assertThat(config.mxidMapper()).isEqualTo(MxidMapper.HEXENCODE);
            assertThat(DefaultSamlMappingProvider.parseConfig(null)).isEqualTo(config);
        }

        @Test
        @DisplayName("Should accept dotreplace")
        void shouldAcceptDotReplace() {
            DefaultSamlMappingConfig config = DefaultSamlMappingProvider.parseConfig(
                Map.of("mxid_source_attribute", "mail", "mxid_mapping", "dotreplace"));

            assertThat(config.mxidSourceAttribute()).isEqualTo("mail");
            assertThat(config.mxidMapper()).isEqualTo(MxidMapper.DOTREPLACE);
        }

        @Test
        @DisplayName("Should reject an unknown mapping")
        void shouldRejectUnknownMapping() {
            assertThatThrownBy(() -> DefaultSamlMappingProvider.parseConfig(Map.of("mxid_mapping", "base64")))
                .isInstanceOf(SamlConfigurationException.class)
                .hasMessageContaining("'base64' is not a valid mxid_mapping value");
        }

        @Test
        @DisplayName("Should report required and optional attributes")
        void shouldReportAttributes() {
            SamlAttributeRequirements requirements = provider.getSamlAttributes();

            assertThat(requirements.required()).containsExactlyInAnyOrder("uid", "username");
            assertThat(requirements.optional()).containsExactlyInAnyOrder("displayName", "email");
        }
    }

    @Nested
    @DisplayName("Remote user id")
    class RemoteUserIdTests {

        @Test
        @DisplayName("Should use the first uid value")
        void shouldUseFirstUid() throws Exception {
            SamlAuthnResponse response = response(Map.of("uid", List.of("alice", "ignored")));

            assertThat(provider.getRemoteUserId(response, REDIRECT_URL)).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should fail when uid is missing")
        void shouldFailWithoutUid() {
            SamlAuthnResponse response = response(Map.of("username", List.of("alice")));

            assertThatThrownBy(() -> provider.getRemoteUserId(response, REDIRECT_URL))
                .isInstanceOf(SamlMissingAttributesException.class)
                .hasMessage("'uid' not in SAML2 response");
        }
    }

    @Nested
    @DisplayName("User attributes")
    class UserAttributesTests {

        @Test
        @DisplayName("Should map the source attribute without suffix on the first attempt")
        void shouldMapFirstAttempt() throws Exception {
            SamlAuthnResponse response = response(Map.of(
                "uid", List.of("a-123"),
                "username", List.of("Alice Smith"),
                "displayName", List.of("Alice"),
                "email", List.of("alice@example.org", "a.smith@example.org")
            ));

            UserAttributes attributes = provider.samlResponseToUserAttributes(response, 0, REDIRECT_URL);

            assertThat(attributes.mxidLocalpart()).isEqualTo("alice=20smith");
            assertThat(attributes.displayName()).isEqualTo("Alice");
            assertThat(attributes.emails()).containsExactly("alice@example.org", "a.smith@example.org");
        }

        @Test
        @DisplayName("Should append the failure count on later attempts")
        void shouldAppendFailureCount() throws Exception {
            SamlAuthnResponse response = response(Map.of("username", List.of("alice")));

            assertThat(provider.samlResponseToUserAttributes(response, 1, REDIRECT_URL).mxidLocalpart())
                .isEqualTo("alice1");
            assertThat(provider.samlResponseToUserAttributes(response, 42, REDIRECT_URL).mxidLocalpart())
                .isEqualTo("alice42");
        }

        @Test
        @DisplayName("Should use the configured dotreplace mapping")
        void shouldUseDotReplace() throws Exception {
            DefaultSamlMappingProvider dotProvider = new DefaultSamlMappingProvider(
                new DefaultSamlMappingConfig("username", MxidMapper.DOTREPLACE));
            SamlAuthnResponse response = response(Map.of("username", List.of("Alice Smith")));

            assertThat(dotProvider.samlResponseToUserAttributes(response, 0, REDIRECT_URL).mxidLocalpart())
                .isEqualTo("alice.smith");
        }

        @Test
        @DisplayName("Should leave display name null and emails empty when absent")
        void shouldHandleAbsentOptionalAttributes() throws Exception {
            SamlAuthnResponse response = response(Map.of("username", List.of("alice")));

            UserAttributes attributes = provider.samlResponseToUserAttributes(response, 0, REDIRECT_URL);

            assertThat(attributes.displayName()).isNull();
            assertThat(attributes.emails()).isEmpty();
        }

        @Test
        @DisplayName("Should fail when the source attribute is missing")
        void shouldFailWithoutSourceAttribute() {
            SamlAuthnResponse response = response(Map.of("uid", List.of("alice")));

            assertThatThrownBy(() -> provider.samlResponseToUserAttributes(response, 0, REDIRECT_URL))
                .isInstanceOf(SamlMissingAttributesException.class)
                .hasMessage("username not in SAML2 response");
        }
    }

    private static SamlAuthnResponse response(Map<String, List<String>> attributes) {
        return new SamlAuthnResponse("id-1", "https://idp.example.org", true, attributes, List.of());
    }
}
