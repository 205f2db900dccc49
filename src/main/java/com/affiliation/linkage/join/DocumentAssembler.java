package com.affiliation.linkage.join;

import com.affiliation.linkage.core.model.FlatFieldRow;
import com.affiliation.linkage.core.model.NormalizedTriple;
import com.affiliation.linkage.rules.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds the ordered author/affiliation structure of one document from its flat rows.
 *
 * <p>Authors and affiliations with a usable coordinate are ordered by sequence. Fields whose
 * coordinate is missing or malformed are kept and placed after all well-formed items, in the
 * order they were seen, and their triples carry {@code coordinatesResolved=false}.</p>
 */
class DocumentAssembler {

    private static final class Affiliation {
        final Integer sequence;
        final boolean resolved;
        String name = "";
        String ref = "";

        Affiliation(Integer sequence, boolean resolved) {
            this.sequence = sequence;
            this.resolved = resolved;
        }
    }

    private static final class Author {
        final Integer sequence;
        final boolean resolved;
        String fullName = "";
        String given = "";
        String family = "";
        final Map<Integer, Affiliation> affiliations = new TreeMap<>();
        final List<Affiliation> unresolvedAffiliations = new ArrayList<>();

        Author(Integer sequence, boolean resolved) {
            this.sequence = sequence;
            this.resolved = resolved;
        }
    }

    private final String documentId;
    private final FieldRoles roles;
    private final Map<Integer, Author> authors = new TreeMap<>();
    private final List<Author> unresolvedAuthors = new ArrayList<>();
    private String originShard = "";
    private long flaggedRows;

    DocumentAssembler(String documentId, FieldRoles roles) {
        this.documentId = documentId;
        this.roles = roles;
    }

    String documentId() {
        return documentId;
    }

    long flaggedRows() {
        return flaggedRows;
    }

    /**
     * Adds one row. Returns false if its field has no role and was ignored.
     */
    boolean accept(FlatFieldRow row) {
        FieldRole role = roles.roleOf(row.fieldName()).orElse(null);
        if (role == null) {
            return false;
        }
        if (originShard.isEmpty()) {
            originShard = row.originShard();
        }

        PathCoordinates coordinates = PathCoordinates.parse(row.indexedPath());
        Integer authorSequence = coordinates.authorSequence();
        Author author;
        if (authorSequence == null) {
            flaggedRows++;
            author = new Author(null, false);
            unresolvedAuthors.add(author);
        } else {
            author = authors.computeIfAbsent(authorSequence, seq -> new Author(seq, true));
        }

        String value = row.value();
        switch (role) {
            case AUTHOR_FULL_NAME -> author.fullName = firstNonEmpty(author.fullName, value);
            case AUTHOR_GIVEN_NAME -> author.given = firstNonEmpty(author.given, value);
            case AUTHOR_FAMILY_NAME -> author.family = firstNonEmpty(author.family, value);
            case AFFILIATION_NAME, AFFILIATION_EXTERNAL_REF -> {
                Affiliation affiliation = affiliationFor(author, coordinates.affiliationSequence());
                if (role == FieldRole.AFFILIATION_NAME) {
                    affiliation.name = firstNonEmpty(affiliation.name, value);
                } else {
                    affiliation.ref = firstNonEmpty(affiliation.ref, value);
                }
            }
        }
        return true;
    }

    private Affiliation affiliationFor(Author author, Integer sequence) {
        if (sequence == null) {
            if (author.resolved) {
                flaggedRows++;
            }
            Affiliation affiliation = new Affiliation(null, false);
            author.unresolvedAffiliations.add(affiliation);
            return affiliation;
        }
        return author.affiliations.computeIfAbsent(sequence, seq -> new Affiliation(seq, true));
    }

    /**
     * Emits one triple per (author, affiliation), or one per author without affiliations.
     */
    List<NormalizedTriple> finish() {
        List<NormalizedTriple> triples = new ArrayList<>();
        List<Author> ordered = new ArrayList<>(authors.values());
        ordered.addAll(unresolvedAuthors);
        for (Author author : ordered) {
            String fullName = author.fullName.isEmpty()
                    ? (author.given + " " + author.family).trim()
                    : author.fullName;
            NormalizedTriple.Builder base = NormalizedTriple.builder()
                    .documentId(documentId)
                    .authorSequence(author.sequence)
                    .authorName(fullName, TextNormalizer.normalize(fullName))
                    .givenName(author.given, TextNormalizer.normalize(author.given))
                    .familyName(author.family, TextNormalizer.normalize(author.family))
                    .originShard(originShard);

            List<Affiliation> affiliations = new ArrayList<>(author.affiliations.values());
            affiliations.addAll(author.unresolvedAffiliations);
            if (affiliations.isEmpty()) {
                triples.add(base.coordinatesResolved(author.resolved).build());
                continue;
            }
            for (Affiliation affiliation : affiliations) {
                triples.add(base
                        .affiliationSequence(affiliation.sequence)
                        .affiliationName(affiliation.name, TextNormalizer.normalize(affiliation.name))
                        .affiliationExternalRef(affiliation.ref)
                        .coordinatesResolved(author.resolved && affiliation.resolved)
                        .build());
            }
        }
        return triples;
    }

    private static String firstNonEmpty(String current, String candidate) {
        return current.isEmpty() ? candidate : current;
    }
}
