package rs.lukaj.networking.params;

import rs.lukaj.networking.EncodingException;
import rs.lukaj.networking.Utils;
import rs.lukaj.networking.connections.Headers;
import rs.lukaj.networking.connections.Http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns request parameters and form data parts into the url, headers and body of the request,
 * according to the {@link ParameterType}. The encoder never touches the network; every problem
 * with the parameters is reported as {@link EncodingException}.
 */
public class ParameterEncoder {
    private static final String CRLF = "\r\n";

    private final Supplier<String> boundaries;

    public ParameterEncoder() {
        this(() -> "Boundary-" + UUID.randomUUID());
    }

    /**
     * @param boundaries source of multipart boundaries, one is taken for each multipart request
     */
    public ParameterEncoder(Supplier<String> boundaries) {
        this.boundaries = boundaries;
    }

    /**
     * Encode the request.
     * @param verb http method, decides whether form parameters go into the url
     * @param url composed url of the request, without parameters
     * @param type how parameters should be encoded; see {@link ParameterType#resolve}
     * @param parameters loosely-typed parameters, converted with {@link ParameterValue#of(Object)}
     * @param parts binary parts; only used for {@link ParameterType#MULTIPART_FORM_DATA}
     * @return encoded request
     * @throws EncodingException if parameters or parts can't be encoded using the given type
     */
    public EncodedRequest encode(Http.Verb verb, URI url, ParameterType type, Object parameters,
                                 List<FormDataPart> parts) throws EncodingException {
        Headers headers = new Headers();
        switch (type) {
            case NONE:
                return new EncodedRequest(url, headers, null);
            case FORM_URL_ENCODED: {
                String form = formToString(ParameterValue.of(parameters));
                if(verb.sendsParametersInUrl()) {
                    return new EncodedRequest(form.isEmpty() ? url : appendDataToUrl(url, form), headers, null);
                }
                headers.setHeader("Content-Type", type.getContentType());
                return new EncodedRequest(url, headers, form.getBytes(UTF_8));
            }
            case JSON: {
                if(parameters == null) return new EncodedRequest(url, headers, null);
                byte[] body;
                try {
                    body = Utils.jsonMapper().writeValueAsBytes(ParameterValue.of(parameters).toJson());
                } catch (IOException e) {
                    throw new EncodingException("Cannot serialize parameters as JSON", e);
                }
                headers.setHeader("Content-Type", type.getContentType());
                return new EncodedRequest(url, headers, body);
            }
            case MULTIPART_FORM_DATA: {
                String boundary = boundaries.get();
                headers.setHeader("Content-Type", type.getContentType() + "; boundary=" + boundary);
                return new EncodedRequest(url, headers, multipart(boundary, ParameterValue.of(parameters), parts));
            }
            default:
                throw new EncodingException("Unknown parameter type " + type);
        }
    }

    private static URI appendDataToUrl(URI url, String form) throws EncodingException {
        StringBuilder fullUrl = new StringBuilder(url.toString());
        int fragment = fullUrl.indexOf("#");
        String ref = null;
        if(fragment >= 0) {
            ref = fullUrl.substring(fragment);
            fullUrl.setLength(fragment);
        }
        if(url.getRawQuery() == null) fullUrl.append("?");
        else fullUrl.append("&");
        fullUrl.append(form);
        if(ref != null) fullUrl.append(ref);
        try {
            return new URI(fullUrl.toString());
        } catch (URISyntaxException e) {
            throw new EncodingException("Cannot append parameters to " + url, e);
        }
    }

    private static String formToString(ParameterValue parameters) throws EncodingException {
        if(parameters.getKind() == ParameterValue.Kind.SCALAR && parameters.getScalar() == null) return "";
        if(parameters.getKind() != ParameterValue.Kind.MAPPING)
            throw new EncodingException("Form parameters must be a mapping, got " + parameters.getKind());

        StringBuilder urlParams = new StringBuilder(parameters.getEntries().size() * 16);
        for(Map.Entry<String, ParameterValue> param : parameters.getEntries().entrySet()) {
            for(String value : formValues(param.getKey(), param.getValue())) {
                if(urlParams.length() > 0) urlParams.append('&');
                urlParams.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8)).append('=')
                        .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        return urlParams.toString();
    }

    //sequences repeat the key; anything deeper has no standard form representation
    private static List<String> formValues(String name, ParameterValue value) throws EncodingException {
        List<String> values = new ArrayList<>();
        switch (value.getKind()) {
            case SCALAR:
                values.add(value.asText());
                break;
            case SEQUENCE:
                for(ParameterValue element : value.getElements()) {
                    if(element.getKind() != ParameterValue.Kind.SCALAR)
                        throw new EncodingException("Parameter " + name + " contains a nested " + element.getKind());
                    values.add(element.asText());
                }
                break;
            default:
                throw new EncodingException("Parameter " + name + " is a " + value.getKind() + ", which can't be form-encoded");
        }
        return values;
    }

    private static byte[] multipart(String boundary, ParameterValue parameters, List<FormDataPart> parts)
            throws EncodingException {
        List<FormDataPart> allParts = new ArrayList<>();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        boolean nullParameters = parameters.getKind() == ParameterValue.Kind.SCALAR && parameters.getScalar() == null;
        if(!nullParameters) {
            if(parameters.getKind() != ParameterValue.Kind.MAPPING)
                throw new EncodingException("Multipart parameters must be a mapping, got " + parameters.getKind());
            for(Map.Entry<String, ParameterValue> param : parameters.getEntries().entrySet()) {
                if(param.getValue().getKind() == ParameterValue.Kind.PART) {
                    allParts.add(param.getValue().getPart());
                    continue;
                }
                for(String value : formValues(param.getKey(), param.getValue())) {
                    write(body, "--" + boundary + CRLF);
                    write(body, "Content-Disposition: form-data; name=\"" + escape(param.getKey()) + "\"" + CRLF + CRLF);
                    write(body, value + CRLF);
                }
            }
        }
        if(parts != null) allParts.addAll(parts);
        if(allParts.isEmpty() && nullParameters) throw new EncodingException("Multipart request without any content");

        for(FormDataPart part : allParts) {
            if(part == null) throw new EncodingException("Form data part can't be null");
            if(part.getFieldName() == null || part.getFieldName().isEmpty())
                throw new EncodingException("Form data part without field name");
            if(part.getData() == null || part.getData().length == 0)
                throw new EncodingException("Form data part " + part.getFieldName() + " has no data");
            write(body, "--" + boundary + CRLF);
            write(body, "Content-Disposition: form-data; name=\"" + escape(part.getFieldName()) + "\"; filename=\""
                    + escape(part.getFilename()) + "\"" + CRLF);
            write(body, "Content-Type: " + part.getContentType() + CRLF + CRLF);
            body.writeBytes(part.getData());
            write(body, CRLF);
        }
        write(body, "--" + boundary + "--" + CRLF);
        return body.toByteArray();
    }

    private static String escape(String name) {
        return name.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static void write(ByteArrayOutputStream out, String str) {
        out.writeBytes(str.getBytes(UTF_8));
    }
}
