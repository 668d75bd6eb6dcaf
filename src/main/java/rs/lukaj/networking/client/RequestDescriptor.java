package rs.lukaj.networking.client;

import rs.lukaj.networking.ResponseType;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.connections.Http;
import rs.lukaj.networking.params.FormDataPart;
import rs.lukaj.networking.params.ParameterType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the {@link Dispatcher} needs to know about one request. Immutable; use
 * {@link NetworkRequestBuilder} to make one.
 */
public class RequestDescriptor {
    private final Http.Verb verb;
    private final String path;
    private final String cacheName;
    private final ParameterType parameterType;
    private final Object parameters;
    private final List<FormDataPart> parts;
    private final ResponseType responseType;
    private final CachingPolicy cachingPolicy;

    public RequestDescriptor(Http.Verb verb, String path, String cacheName, ParameterType parameterType,
                             Object parameters, List<FormDataPart> parts, ResponseType responseType,
                             CachingPolicy cachingPolicy) {
        this.verb = Objects.requireNonNull(verb, "verb");
        this.path = Objects.requireNonNull(path, "path");
        this.cacheName = cacheName;
        this.parameterType = parameterType == null ? ParameterType.NONE : parameterType;
        this.parameters = parameters;
        this.parts = parts == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(parts));
        this.responseType = Objects.requireNonNull(responseType, "responseType");
        this.cachingPolicy = cachingPolicy == null ? CachingPolicy.NONE : cachingPolicy;
    }

    public Http.Verb getVerb() {
        return verb;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return name the response is cached under: the explicitly set cache name, or the path
     */
    public String getCacheName() {
        return cacheName == null ? path : cacheName;
    }

    /**
     * @return parameter type as requested; see {@link ParameterType#resolve} for the one actually used
     */
    public ParameterType getParameterType() {
        return parameterType;
    }

    public Object getParameters() {
        return parameters;
    }

    public List<FormDataPart> getParts() {
        return parts;
    }

    public ResponseType getResponseType() {
        return responseType;
    }

    public CachingPolicy getCachingPolicy() {
        return cachingPolicy;
    }

    @Override
    public String toString() {
        return verb + " " + path;
    }
}
