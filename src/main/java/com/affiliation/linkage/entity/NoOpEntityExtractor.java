package com.affiliation.linkage.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Extractor used when entity extraction is disabled or unavailable. Finds nothing.
 */
public class NoOpEntityExtractor implements EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(NoOpEntityExtractor.class);

    @Override
    public List<OrganizationCandidate> extractOrganizations(String text) {
        log.trace("entity.noop text='{}'", text);
        return List.of();
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
