package com.affiliation.linkage.config;

import com.affiliation.linkage.join.FieldRole;
import com.affiliation.linkage.join.FieldRoles;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Join section: extracted field names per role, e.g.
 * <pre>
 * fieldRoles:
 *   author_full_name: [authorships.author.display_name]
 *   affiliation_name: [authorships.raw_affiliation_strings]
 * </pre>
 * Without roles the OpenAlex and Crossref defaults apply.
 */
public record JoinConfig(Map<String, List<String>> fieldRoles) {

    public JoinConfig {
        fieldRoles = fieldRoles != null ? Map.copyOf(fieldRoles) : Map.of();
    }

    public static JoinConfig defaults() {
        return new JoinConfig(Map.of());
    }

    public FieldRoles toFieldRoles() {
        if (fieldRoles.isEmpty()) {
            return FieldRoles.defaults();
        }
        Map<FieldRole, List<String>> byRole = new EnumMap<>(FieldRole.class);
        fieldRoles.forEach((role, fields) -> byRole.put(FieldRole.valueOf(ExtractionConfig.constant(role)), fields));
        return FieldRoles.of(byRole);
    }
}
