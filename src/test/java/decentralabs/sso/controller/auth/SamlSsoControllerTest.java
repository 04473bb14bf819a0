package decentralabs.sso.controller.auth;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Set;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import decentralabs.sso.dto.auth.SsoCompletion;
import decentralabs.sso.dto.auth.SsoRequestContext;
import decentralabs.sso.exception.GlobalExceptionHandler;
import decentralabs.sso.exception.MxidMappingExhaustedException;
import decentralabs.sso.exception.SamlMissingAttributesException;
import decentralabs.sso.exception.SamlUnsignedResponseException;
import decentralabs.sso.model.SamlAttributeRequirements;
import decentralabs.sso.service.auth.SamlHandler;

@ExtendWith(MockitoExtension.class)
class SamlSsoControllerTest {

    private static final String REDIRECT_URL = "https://client/cb";

    @Mock
    private SamlHandler samlHandler;

    @InjectMocks
    private SamlSsoController samlSsoController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(samlSsoController, "attributeRequirements",
            new SamlAttributeRequirements(Set.of("uid"), Set.of("displayName", "email")));
        mockMvc = MockMvcBuilders.standaloneSetup(samlSsoController)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("Redirect endpoint")
    class RedirectTests {

        @Test
        @DisplayName("Should redirect the browser to the identity provider")
        void shouldRedirectToIdentityProvider() throws Exception {
            when(samlHandler.handleRedirectRequest(REDIRECT_URL, null)).thenReturn("https://idp/sso?SAMLRequest=abc");

            mockMvc.perform(get("/auth/saml2/redirect").param("redirectUrl", REDIRECT_URL))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://idp/sso?SAMLRequest=abc"));
        }

        @Test
        @DisplayName("Should pass the interactive-auth session through")
        void shouldPassUiAuthSession() throws Exception {
            when(samlHandler.handleRedirectRequest(REDIRECT_URL, "ui-1")).thenReturn("https://idp/sso");

            mockMvc.perform(get("/auth/saml2/redirect").param("redirectUrl", REDIRECT_URL).param("session", "ui-1"))
                .andExpect(status().isFound());
        }

        @Test
        @DisplayName("Should return 500 when the request cannot be prepared")
        void shouldReturn500OnFailure() throws Exception {
            when(samlHandler.handleRedirectRequest(REDIRECT_URL, null))
                .thenThrow(new IllegalStateException("prepare_for_authenticate didn't return a Location header"));

            mockMvc.perform(get("/auth/saml2/redirect").param("redirectUrl", REDIRECT_URL))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"));
        }

        @Test
        @DisplayName("Should return 400 without a redirect URL")
        void shouldReturn400WithoutRedirectUrl() throws Exception {
            mockMvc.perform(get("/auth/saml2/redirect"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing required parameter: redirectUrl"));
        }
    }

    @Nested
    @DisplayName("Assertion consumer endpoint")
    class AuthnResponseTests {

        @Test
        @DisplayName("Should redirect back to the client after a fresh login")
        void shouldRedirectAfterLogin() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenReturn(SsoCompletion.redirect("@alice:example.org", REDIRECT_URL + "?loginToken=t"));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", REDIRECT_URL + "?loginToken=t"));
        }

        @Test
        @DisplayName("Should render the confirmation page for interactive auth")
        void shouldRenderPageForUiAuth() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenReturn(SsoCompletion.page("@alice:example.org", "<html>Thank you</html>"));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isOk())
                .andExpect(content().string(Matchers.containsString("Thank you")));
        }

        @Test
        @DisplayName("Should return 400 for a rejected response")
        void shouldReturn400ForRejectedResponse() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenThrow(new SamlUnsignedResponseException("SAML2 response was not signed"));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("SAML2 response was not signed"));
        }

        @Test
        @DisplayName("Should return 400 when a required attribute is missing")
        void shouldReturn400ForMissingAttribute() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenThrow(new SamlMissingAttributesException("'uid' not in SAML2 response"));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("'uid' not in SAML2 response"));
        }

        @Test
        @DisplayName("Should return 500 when no localpart could be allocated")
        void shouldReturn500WhenExhausted() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenThrow(new MxidMappingExhaustedException("alice", 1000));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Unable to generate a Matrix ID from the SAML response"));
        }

        @Test
        @DisplayName("Should hide unexpected failures")
        void shouldHideUnexpectedFailures() throws Exception {
            when(samlHandler.handleSamlResponse(eq("b64"), eq(REDIRECT_URL), any(SsoRequestContext.class)))
                .thenThrow(new IllegalStateException("db password is hunter2"));

            mockMvc.perform(post("/auth/saml2/authn_response")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .param("SAMLResponse", "b64")
                    .param("RelayState", REDIRECT_URL))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal server error"));
        }
    }

    @Test
    @DisplayName("Should list the attributes the mapping provider consumes")
    void shouldListAttributes() throws Exception {
        mockMvc.perform(get("/auth/saml2/attributes"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.required[0]").value("uid"))
            .andExpect(jsonPath("$.optional", Matchers.hasSize(2)));
    }
}
