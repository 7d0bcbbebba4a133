package com.github.dimitryivaniuta.responsecache.cache.hint;

import java.util.Objects;

/**
 * Hint visited for one resolved field. Path segments are dot separated ("user.profile.name");
 * a path without a dot is a root field.
 */
public record FieldCacheHint(String path, CacheHint hint) {

    public FieldCacheHint {
        Objects.requireNonNull(path, "path must not be null");
        hint = (hint == null) ? CacheHint.none() : hint;
    }

    public static FieldCacheHint of(String path, CacheHint hint) {
        return new FieldCacheHint(path, hint);
    }

    public boolean isRootField() {
        return path.indexOf('.') < 0;
    }
}
