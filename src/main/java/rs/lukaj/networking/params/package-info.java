/**
 * Turns request parameters into url queries and request bodies: urlencoded forms, JSON and multipart.
 */
package rs.lukaj.networking.params;
