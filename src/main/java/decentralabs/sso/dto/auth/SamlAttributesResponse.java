package decentralabs.sso.dto.auth;

import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Response DTO listing the assertion attributes the mapping provider consumes
 */
@Getter
@AllArgsConstructor
public class SamlAttributesResponse {
    private final Set<String> required;
    private final Set<String> optional;
}
