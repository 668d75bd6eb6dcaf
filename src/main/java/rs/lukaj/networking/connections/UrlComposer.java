package rs.lukaj.networking.connections;

import rs.lukaj.networking.MalformedPathException;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * Joins a base url and a request path into an absolute URI. Paths which are already absolute
 * (start with http:// or https://) are used as-is.
 */
public class UrlComposer {

    private UrlComposer() {
    }

    /**
     * Compose the url for the given path. Characters which aren't allowed in URLs (e.g. spaces) are
     * percent-encoded; already encoded sequences are left alone.
     * @param baseUrl base url of the client, can be null if path is absolute
     * @param path request path
     * @return absolute URI
     * @throws MalformedPathException if no valid absolute URI can be made
     */
    public static URI compose(String baseUrl, String path) throws MalformedPathException {
        if(path == null) throw new MalformedPathException("Path can't be null");
        String joined = isAbsolute(path) ? path : join(baseUrl, path);
        try {
            URI uri = new URI(joined);
            if(uri.isAbsolute() && uri.getHost() != null) return uri;
        } catch (URISyntaxException e) {
            //try quoting illegal characters below
        }
        try {
            URL url = new URL(joined);
            URI uri = new URI(url.getProtocol(), url.getUserInfo(), url.getHost(), url.getPort(), url.getPath(),
                    url.getQuery(), url.getRef());
            if(uri.getHost() == null || uri.getHost().isEmpty())
                throw new MalformedPathException("No host in " + joined);
            return uri;
        } catch (MalformedURLException | URISyntaxException e) {
            throw new MalformedPathException("Cannot compose url from base " + baseUrl + " and path " + path, e);
        }
    }

    private static boolean isAbsolute(String path) {
        String lower = path.toLowerCase();
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String join(String base, String path) throws MalformedPathException {
        if(base == null || base.isEmpty()) throw new MalformedPathException("Relative path " + path + " without base url");
        if(path.isEmpty()) return base;
        if(base.endsWith("/") && path.startsWith("/")) return base + path.substring(1);
        if(base.endsWith("/") || path.startsWith("/")) return base + path;
        return base + "/" + path;
    }
}
