package com.github.dimitryivaniuta.responsecache.cache.engine;

/**
 * Operation kind as determined by the execution engine's planning step.
 * Only queries take part in response caching.
 */
public enum OperationType {
    QUERY,
    MUTATION,
    SUBSCRIPTION
}
