package com.github.dimitryivaniuta.responsecache.cache.hint;

/**
 * Visibility of a cached response.
 *
 * - PUBLIC: shareable across all callers.
 * - PRIVATE: must be isolated per session; never served to another session.
 */
public enum CacheScope {
    PUBLIC("public"),
    PRIVATE("private");

    private final String directive;

    CacheScope(String directive) { this.directive = directive; }

    /** Value used in the Cache-Control header. */
    public String directive() { return directive; }
}
