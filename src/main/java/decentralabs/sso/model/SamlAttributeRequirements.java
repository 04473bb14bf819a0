package decentralabs.sso.model;

import java.util.Set;

/**
 * Assertion attributes a mapping provider needs, and those it uses when present.
 */
public record SamlAttributeRequirements(Set<String> required, Set<String> optional) {

    public SamlAttributeRequirements {
        required = Set.copyOf(required);
        optional = Set.copyOf(optional);
    }
}
