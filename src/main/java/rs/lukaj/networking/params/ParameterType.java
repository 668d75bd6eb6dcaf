package rs.lukaj.networking.params;

import rs.lukaj.networking.connections.Http;

import java.util.List;

/**
 * How request parameters are put into the request.
 */
public enum ParameterType {
    /** Parameters are ignored; no body, no query. */
    NONE(null),
    /** key=value pairs, in the query string for GET and DELETE and in the body otherwise. */
    FORM_URL_ENCODED("application/x-www-form-urlencoded"),
    /** Parameters are serialized as JSON body. */
    JSON("application/json"),
    /** Scalar parameters and binary parts in a multipart body. */
    MULTIPART_FORM_DATA("multipart/form-data");

    private final String contentType;

    ParameterType(String contentType) {
        this.contentType = contentType;
    }

    /**
     * @return content type of the body this parameter type produces, without parameters (e.g. boundary)
     */
    public String getContentType() {
        return contentType;
    }

    /**
     * Figures out which parameter type is actually used for the request. Parts always mean multipart;
     * GET and DELETE without parameters never get a body nor a query.
     * @param verb http method
     * @param requested parameter type requested by the caller
     * @param parameters request parameters, possibly null
     * @param parts form data parts, possibly null
     * @return effective parameter type
     */
    public static ParameterType resolve(Http.Verb verb, ParameterType requested, Object parameters,
                                        List<FormDataPart> parts) {
        if(parts != null && !parts.isEmpty()) return MULTIPART_FORM_DATA;
        if(parameters == null && verb.sendsParametersInUrl()) return NONE;
        return requested == null ? NONE : requested;
    }
}
