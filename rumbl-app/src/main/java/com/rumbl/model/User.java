package com.rumbl.model;

/**
 * A user of the site.
 * Users are seeded in UserRepository - no database table, nothing is ever written.
 */
public record User(
    String id,         // e.g. "1"
    String name,       // Display name, may hold several words
    String username    // Handle, e.g. "josevalim"
) {
    public String firstName() {
        if (name == null || name.isBlank()) {
            return "";
        }
        return name.strip().split("\\s+")[0];
    }
}
