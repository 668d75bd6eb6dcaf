package rs.lukaj.networking.cache;

import java.io.IOException;

/**
 * Storage backing the second (file) tier of {@link CacheStore}. Keys are opaque strings; implementations
 * decide how they map onto storage. Eviction, if any, is up to the implementation.
 */
public interface DiskCache {
    /**
     * @param key key of the entry
     * @return stored bytes, or null if nothing is stored under the key
     * @throws IOException if stored entry exists, but can't be read
     */
    byte[] get(String key) throws IOException;

    /**
     * Stores bytes under the key, replacing any previous entry.
     * @param key key of the entry
     * @param data bytes to store
     * @throws IOException if data can't be written
     */
    void put(String key, byte[] data) throws IOException;

    /**
     * Removes the entry if it exists.
     * @param key key of the entry
     * @throws IOException if the entry exists, but can't be removed
     */
    void delete(String key) throws IOException;

    /**
     * Removes all entries.
     * @throws IOException if some entries can't be removed
     */
    void clear() throws IOException;

    /**
     * An empty cache. It doesn't store anything and returns null on {@link #get(String)}.
     */
    class Empty implements DiskCache {
        @Override
        public byte[] get(String key) {
            return null;
        }

        @Override
        public void put(String key, byte[] data) {
        }

        @Override
        public void delete(String key) {
        }

        @Override
        public void clear() {
        }
    }
}
