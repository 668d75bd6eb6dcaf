package rs.lukaj.networking.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {

    /**
     * Denotes a request method (i.e. "http verb")
     */
    public enum Verb {
        GET("GET", P.PARAMS_IN_URL | P.SAFE | P.IDEMPOTENT),
        POST("POST", 0),
        PUT("PUT", P.IDEMPOTENT),
        PATCH("PATCH", 0),
        DELETE("DELETE", P.PARAMS_IN_URL | P.IDEMPOTENT);

        private static class P { //hack around illegal forward reference
            private static final long PARAMS_IN_URL = 1; //form parameters go into the query string, not the body
            private static final long SAFE = 1 << 1;
            private static final long IDEMPOTENT = 1 << 2;
        }

        private final String text;
        private final long properties;

        Verb(String text, long properties) {
            this.text = text;
            this.properties = properties;
        }

        /**
         * Denotes whether form-encoded parameters are sent as a part of the URL. If they aren't, they're sent
         * as a request body.
         * @return whether parameters are appended to the URL
         */
        public boolean sendsParametersInUrl() {
            return (properties & P.PARAMS_IN_URL) != 0;
        }

        /**
         * If method is safe, then requests shouldn't change resource representation.
         * @return whether method is safe
         */
        public boolean isMethodSafe() {
            return (properties & P.SAFE) != 0;
        }

        /**
         * If method is idempotent, request can be made multiple times with the same outcome.
         * @return whether method is idempotent
         */
        public boolean isMethodIdempotent() {
            return (properties & P.IDEMPOTENT) != 0;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * @param statusCode HTTP response status code
     * @return whether the code denotes a successful (2xx) response
     */
    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
