package decentralabs.sso.dto.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;

/**
 * JSON error bodies for the SSO endpoints
 */
public final class SsoErrorResponse {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private SsoErrorResponse() {
    }

    /**
     * Creates error response in JSON format
     */
    public static String errorJson(String message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(Collections.singletonMap("error", message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize SSO error response", e);
        }
    }
}
