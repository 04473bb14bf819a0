package decentralabs.sso.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Nested
    @DisplayName("Client error tests")
    class ClientErrorTests {

        @Test
        @DisplayName("Should return 400 naming the missing parameter")
        void shouldReturn400ForMissingParameter() {
            MissingServletRequestParameterException ex =
                new MissingServletRequestParameterException("RelayState", "String");

            ResponseEntity<Map<String, Object>> response = handler.handleMissingParameter(ex);

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertNotNull(response.getBody());
            assertEquals(false, response.getBody().get("success"));
            assertEquals("Missing required parameter: RelayState", response.getBody().get("message"));
        }

        @Test
        @DisplayName("Should return 400 with the rejection reason")
        void shouldReturn400ForRejectedResponse() {
            ResponseEntity<Map<String, Object>> response = handler.handleSamlAuthenticationException(
                new SamlMalformedResponseException("Unable to parse SAML2 response: bad xml"));

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertEquals("Unable to parse SAML2 response: bad xml", response.getBody().get("message"));
        }

        @Test
        @DisplayName("Should return 400 for illegal arguments")
        void shouldReturn400ForIllegalArgument() {
            ResponseEntity<Map<String, Object>> response =
                handler.handleIllegalArgumentException(new IllegalArgumentException("SAML request id must not be empty"));

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertEquals("SAML request id must not be empty", response.getBody().get("message"));
        }
    }

    @Nested
    @DisplayName("Server error tests")
    class ServerErrorTests {

        @Test
        @DisplayName("Should return 500 when localpart allocation is exhausted")
        void shouldReturn500ForExhaustion() {
            ResponseEntity<Map<String, Object>> response =
                handler.handleMappingExhausted(new MxidMappingExhaustedException("alice", 1000));

            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
            assertEquals("Unable to generate a Matrix ID from the SAML response", response.getBody().get("message"));
        }

        @Test
        @DisplayName("Should not leak registration details")
        void shouldHideRegistrationDetails() {
            ResponseEntity<Map<String, Object>> response = handler.handleRegistrationException(
                new AccountRegistrationException("alice", "Unable to store account: constraint users_pkey"));

            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
            assertEquals("Account registration failed", response.getBody().get("message"));
        }

        @Test
        @DisplayName("Should return 503 for account store failures")
        void shouldReturn503ForStoreFailure() {
            ResponseEntity<Map<String, Object>> response = handler.handleDataAccessException(
                new DataAccessResourceFailureException("connection refused"));

            assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
            assertEquals("Account store temporarily unavailable", response.getBody().get("message"));
        }

        @Test
        @DisplayName("Should return a generic 500 for anything else")
        void shouldReturnGeneric500() {
            ResponseEntity<Map<String, Object>> response =
                handler.handleGenericException(new RuntimeException("secret detail"));

            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
            assertEquals("An unexpected error occurred", response.getBody().get("message"));
        }
    }
}
