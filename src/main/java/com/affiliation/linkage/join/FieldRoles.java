package com.affiliation.linkage.join;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps extracted field names to their {@link FieldRole}.
 */
public final class FieldRoles {

    private final Map<String, FieldRole> roles;

    public FieldRoles(Map<String, FieldRole> roles) {
        this.roles = Map.copyOf(roles);
    }

    /**
     * Roles for the OpenAlex and Crossref field names commonly extracted for authorship data.
     */
    public static FieldRoles defaults() {
        Map<String, FieldRole> roles = new LinkedHashMap<>();
        roles.put("authorships.author.display_name", FieldRole.AUTHOR_FULL_NAME);
        roles.put("authorships.raw_author_name", FieldRole.AUTHOR_FULL_NAME);
        roles.put("authorships.raw_affiliation_strings", FieldRole.AFFILIATION_NAME);
        roles.put("authorships.affiliations.raw_affiliation_string", FieldRole.AFFILIATION_NAME);
        roles.put("authorships.institutions.ror", FieldRole.AFFILIATION_EXTERNAL_REF);
        roles.put("author.name", FieldRole.AUTHOR_FULL_NAME);
        roles.put("author.given", FieldRole.AUTHOR_GIVEN_NAME);
        roles.put("author.family", FieldRole.AUTHOR_FAMILY_NAME);
        roles.put("author.affiliation.name", FieldRole.AFFILIATION_NAME);
        roles.put("author.affiliation.id.id", FieldRole.AFFILIATION_EXTERNAL_REF);
        return new FieldRoles(roles);
    }

    /**
     * Builds roles from lists of field names per role, as found in configuration.
     */
    public static FieldRoles of(Map<FieldRole, List<String>> fieldsByRole) {
        Map<String, FieldRole> roles = new LinkedHashMap<>();
        fieldsByRole.forEach((role, fields) -> fields.forEach(field -> roles.put(field, role)));
        return new FieldRoles(roles);
    }

    public Optional<FieldRole> roleOf(String fieldName) {
        return Optional.ofNullable(roles.get(fieldName));
    }

    public Map<String, FieldRole> asMap() {
        return roles;
    }
}
