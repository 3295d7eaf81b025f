package com.platform.onboarding.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a raw declaration against the published schema before the engine sees it.
 */
public interface SchemaValidator {
    
    /**
     * @throws com.platform.onboarding.error.ValidationException listing every problem found
     */
    void validate(JsonNode declaration);
}
