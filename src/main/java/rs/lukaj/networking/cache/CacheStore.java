package rs.lukaj.networking.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.DecodingException;
import rs.lukaj.networking.ResponseType;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Two-tier cache of decoded responses: memory first, then a {@link DiskCache}. Entries are keyed by
 * cache name <em>and</em> {@link ResponseType}, so the same name can't return a JSON object where an
 * image is expected. Entries are never expired here; they're overwritten by newer responses or removed
 * explicitly.
 * <br/>
 * Problems with the disk tier never fail the caller: a failed read is a miss, a failed write leaves
 * only the memory copy.
 */
public class CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    private final Map<Key, Object> memory = new HashMap<>();
    private final DiskCache disk;
    private final Object lock = new Object();

    public CacheStore(DiskCache disk) {
        this.disk = disk == null ? new DiskCache.Empty() : disk;
    }

    public DiskCache getDiskCache() {
        return disk;
    }

    /**
     * Look for an object in all tiers.
     * @see #get(String, ResponseType, CachingPolicy)
     */
    public Object get(String cacheName, ResponseType type) {
        return get(cacheName, type, CachingPolicy.MEMORY_AND_FILE);
    }

    /**
     * Look for an object in the tiers the policy allows, memory first. If it's found on disk, it's put
     * in memory, so the next lookup doesn't need the disk.
     * @param cacheName name under which the object was stored
     * @param type expected type of the object
     * @param policy which tiers to look in
     * @return cached object, instance of {@link ResponseType#getJavaType()}, or null if there is none
     */
    public Object get(String cacheName, ResponseType type, CachingPolicy policy) {
        if(!policy.shouldLookInCache()) return null;
        Key key = new Key(cacheName, type);
        synchronized (lock) {
            Object cached = memory.get(key);
            if(cached != null || !policy.usesFile()) return cached;

            byte[] data;
            try {
                data = disk.get(key.toDiskKey());
            } catch (IOException e) {
                logger.warn("Cannot read {} from file cache, treating as a miss", key, e);
                return null;
            }
            if(data == null) return null;
            try {
                cached = type.decode(data);
            } catch (DecodingException e) {
                logger.warn("Corrupt file cache entry {}, removing it", key, e);
                deleteFromDisk(key);
                return null;
            }
            memory.put(key, cached);
            logger.debug("Promoted {} from file cache to memory", key);
            return cached;
        }
    }

    /**
     * Store an object in the tiers selected by the policy. Existing entry under the same name and type
     * is replaced.
     * @param cacheName name to store object under
     * @param object decoded object, instance of {@link ResponseType#getJavaType()}
     * @param type type of the object
     * @param policy which tiers to store the object in
     */
    public void put(String cacheName, Object object, ResponseType type, CachingPolicy policy) {
        if(!policy.shouldStoreInCache()) return;
        if(!type.isInstance(object))
            throw new IllegalArgumentException("Expected " + type.getJavaType().getSimpleName() + " for " + type
                    + ", got " + (object == null ? "null" : object.getClass().getSimpleName()));
        Key key = new Key(cacheName, type);
        synchronized (lock) {
            memory.put(key, object);
            if(!policy.usesFile()) return;
            try {
                disk.put(key.toDiskKey(), type.encode(object));
            } catch (IOException e) {
                logger.warn("Cannot write {} to file cache, keeping it only in memory", key, e);
            }
        }
    }

    /**
     * Removes every entry stored under the name, whatever its type, from both tiers.
     * @param cacheName name of the entry
     */
    public void invalidate(String cacheName) {
        synchronized (lock) {
            for(ResponseType type : ResponseType.values()) {
                Key key = new Key(cacheName, type);
                memory.remove(key);
                deleteFromDisk(key);
            }
        }
    }

    /**
     * Drops the memory tier. Objects stored in the file tier are read again on the next lookup.
     */
    public void clearMemory() {
        synchronized (lock) {
            memory.clear();
        }
    }

    /**
     * Drops both tiers.
     */
    public void clear() {
        synchronized (lock) {
            memory.clear();
            try {
                disk.clear();
            } catch (IOException e) {
                logger.warn("Cannot clear file cache", e);
            }
        }
    }

    public int getMemorySize() {
        synchronized (lock) {
            return memory.size();
        }
    }

    private void deleteFromDisk(Key key) {
        try {
            disk.delete(key.toDiskKey());
        } catch (IOException e) {
            logger.warn("Cannot remove {} from file cache", key, e);
        }
    }


    private static class Key {
        private final String name;
        private final ResponseType type;

        private Key(String name, ResponseType type) {
            this.name = Objects.requireNonNull(name, "Cache name can't be null");
            this.type = type;
        }

        private String toDiskKey() {
            return type.name().toLowerCase() + ":" + name;
        }

        @Override
        public boolean equals(Object obj) {
            if(!(obj instanceof Key)) return false;
            Key other = (Key) obj;
            return name.equals(other.name) && type == other.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return toDiskKey();
        }
    }
}
