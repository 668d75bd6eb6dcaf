package rs.lukaj.networking.cache;

/**
 * Defines a caching policy for requests: which cache tiers a response is looked up in before making
 * the request, and stored in after a successful response.
 */
public enum CachingPolicy {
    /** Bypass cache completely. */
    NONE(false, false),
    /** Use only in-memory cache. */
    MEMORY(true, false),
    /** Use in-memory cache backed by the file cache. File hits are copied into memory. */
    MEMORY_AND_FILE(true, true);

    private final boolean memory;
    private final boolean file;

    CachingPolicy(boolean memory, boolean file) {
        this.memory = memory;
        this.file = file;
    }

    /**
     * Should caller check value in cache before making the request. If true and value is present,
     * caller shouldn't make a network request, and rather use the cached object.
     * @return whether request may be in cache
     */
    public boolean shouldLookInCache() {
        return memory || file;
    }

    /**
     * Should successful responses be stored in cache.
     * @return whether response should be in cache
     */
    public boolean shouldStoreInCache() {
        return memory || file;
    }

    public boolean usesMemory() {
        return memory;
    }

    public boolean usesFile() {
        return file;
    }
}
