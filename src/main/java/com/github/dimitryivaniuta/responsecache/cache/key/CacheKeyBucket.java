package com.github.dimitryivaniuta.responsecache.cache.key;

/**
 * Disjoint key namespaces for one logical request.
 */
public enum CacheKeyBucket {
    /** No session: shared by every anonymous caller. */
    ANONYMOUS_PUBLIC("anonymous"),
    /** Session present, PUBLIC response: shared by all authenticated callers, keyed by session presence only. */
    AUTHENTICATED_PUBLIC("authenticated"),
    /** PRIVATE response: keyed by the exact session id. */
    PRIVATE("private");

    private final String tag;

    CacheKeyBucket(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
