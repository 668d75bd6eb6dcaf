/**
 * Low-level communication with server. More high-level (i.e. usable) stuff is located inside the client package.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.networking.connections.Transport} sends a composed request and reports the raw response.
 * {@link rs.lukaj.networking.connections.JdkTransport} implements it on top of {@link java.net.http.HttpClient},
 * over HTTP/1.1, decompressing gzip and deflate bodies.
 * <br/>
 * {@link rs.lukaj.networking.connections.FakingTransport} wraps another transport and answers some requests
 * with canned responses, which is handy for tests and for developing against an unfinished server.
 * <br/>
 * {@link rs.lukaj.networking.connections.UrlComposer} puts together base url and request path.
 */
package rs.lukaj.networking.connections;
