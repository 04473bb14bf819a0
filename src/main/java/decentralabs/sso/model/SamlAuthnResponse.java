package decentralabs.sso.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An authentication response already parsed and checked by the SAML library.
 *
 * @param inResponseTo id of the AuthnRequest this response answers
 * @param issuer       entity id of the identity provider
 * @param signed       whether the library found a valid signature
 * @param attributes   attribute values by attribute name
 * @param assertions   serialized assertions, kept for audit logging
 */
public record SamlAuthnResponse(
    String inResponseTo,
    String issuer,
    boolean signed,
    Map<String, List<String>> attributes,
    List<String> assertions
) {
    public SamlAuthnResponse {
        if (attributes == null) {
            attributes = Collections.emptyMap();
        } else {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            attributes.forEach((name, values) -> copy.put(name, values == null ? List.of() : List.copyOf(values)));
            attributes = Collections.unmodifiableMap(copy);
        }
        assertions = assertions == null ? Collections.emptyList() : List.copyOf(assertions);
    }

    public Optional<String> firstValue(String name) {
        List<String> values = attributes.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public List<String> values(String name) {
        return attributes.getOrDefault(name, List.of());
    }
}
