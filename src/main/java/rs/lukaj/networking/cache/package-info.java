/**
 * Memory and file cache of decoded responses.
 * {@link rs.lukaj.networking.cache.CachingPolicy} decides which tiers a request uses.
 */
package rs.lukaj.networking.cache;
