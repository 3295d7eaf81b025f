package com.platform.onboarding.schema;

/**
 * A reference buried inside a structured property value.
 * 
 * @param path dot separated field path; arrays met along the way are walked element by element
 * @param target class the referenced name must resolve to
 */
public record NestedReference(String path, ConfigClass target) {
    
    public String[] segments() {
        return path.split("\\.");
    }
}
