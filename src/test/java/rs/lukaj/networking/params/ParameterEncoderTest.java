package rs.lukaj.networking.params;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import rs.lukaj.networking.EncodingException;
import rs.lukaj.networking.Utils;
import rs.lukaj.networking.connections.Http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterEncoderTest {
    private static final URI SEARCH = URI.create("https://api.example.com/search");
    private final ParameterEncoder encoder = new ParameterEncoder(() -> "TestBoundary");

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for(int i = 0; i < keyValues.length; i += 2) map.put((String) keyValues[i], keyValues[i + 1]);
        return map;
    }

    @Test
    public void formGoesIntoQueryForGet() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.GET, SEARCH, ParameterType.FORM_URL_ENCODED,
                params("q", "cats & dogs", "tag", Arrays.asList("a", "b"), "page", 2), null);

        assertEquals("https://api.example.com/search?q=cats+%26+dogs&tag=a&tag=b&page=2", request.getUrl().toString());
        assertFalse(request.hasBody());
        assertNull(request.getHeaders().getContentType());
    }

    @Test
    public void formAppendsToExistingQueryAndKeepsFragment() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.DELETE, URI.create("https://api.example.com/items?all=true#top"),
                ParameterType.FORM_URL_ENCODED, params("id", 7), null);
        assertEquals("https://api.example.com/items?all=true&id=7#top", request.getUrl().toString());
    }

    @Test
    public void emptyFormLeavesUrlAlone() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.GET, SEARCH, ParameterType.FORM_URL_ENCODED,
                new HashMap<String, Object>(), null);
        assertEquals(SEARCH, request.getUrl());
        assertFalse(request.hasBody());
    }

    @Test
    public void formGoesIntoBodyForPost() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.POST, SEARCH, ParameterType.FORM_URL_ENCODED,
                params("name", "Ana Maria", "admin", true, "nothing", null), null);

        assertEquals(SEARCH, request.getUrl());
        assertEquals("application/x-www-form-urlencoded", request.getHeaders().getContentType());
        assertEquals("name=Ana+Maria&admin=true&nothing=", new String(request.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void formRejectsNesting() {
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH, ParameterType.FORM_URL_ENCODED,
                params("user", params("name", "x")), null));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.GET, SEARCH, ParameterType.FORM_URL_ENCODED,
                params("users", Collections.singletonList(Collections.singletonList("x"))), null));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.GET, SEARCH, ParameterType.FORM_URL_ENCODED,
                Arrays.asList("a", "b"), null));
    }

    @Test
    public void jsonBody() throws EncodingException, IOException {
        EncodedRequest request = encoder.encode(Http.Verb.PUT, SEARCH, ParameterType.JSON,
                params("name", "x", "scores", Arrays.asList(1, 2.5),
                        "profile", params("active", false, "nickname", null)), null);

        assertEquals("application/json", request.getHeaders().getContentType());
        JsonNode sent = Utils.jsonMapper().readTree(request.getBody());
        assertEquals("x", sent.get("name").asText());
        assertEquals(2.5, sent.get("scores").get(1).asDouble());
        assertFalse(sent.get("profile").get("active").asBoolean());
        assertTrue(sent.get("profile").get("nickname").isNull());
    }

    @Test
    public void jsonFromTree() throws EncodingException, IOException {
        JsonNode tree = Utils.jsonMapper().readTree("{\"ids\":[1,2,3]}");
        EncodedRequest request = encoder.encode(Http.Verb.POST, SEARCH, ParameterType.JSON, tree, null);
        assertEquals(tree, Utils.jsonMapper().readTree(request.getBody()));
    }

    @Test
    public void jsonWithoutParameters() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.POST, SEARCH, ParameterType.JSON, null, null);
        assertFalse(request.hasBody());
        assertNull(request.getHeaders().getContentType());
    }

    @Test
    public void jsonRejectsWhatItCannotRepresent() {
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH, ParameterType.JSON,
                params("ratio", Double.NaN), null));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH, ParameterType.JSON,
                params("avatar", FormDataPart.png("avatar", null, new byte[]{1})), null));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH, ParameterType.JSON,
                params("thread", new Thread()), null));
    }

    @Test
    public void noneIgnoresParameters() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.POST, SEARCH, ParameterType.NONE, params("a", 1), null);
        assertEquals(SEARCH, request.getUrl());
        assertFalse(request.hasBody());
        assertTrue(request.getHeaders().isEmpty());
    }

    @Test
    public void multipartBody() throws EncodingException {
        byte[] image = {(byte) 0x89, 'P', 'N', 'G'};
        EncodedRequest request = encoder.encode(Http.Verb.POST, SEARCH, ParameterType.MULTIPART_FORM_DATA,
                params("title", "Me"), Collections.singletonList(FormDataPart.png("avatar", "me.png", image)));

        assertEquals("multipart/form-data; boundary=TestBoundary", request.getHeaders().getContentType());
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.writeBytes(("--TestBoundary\r\n"
                + "Content-Disposition: form-data; name=\"title\"\r\n\r\n"
                + "Me\r\n"
                + "--TestBoundary\r\n"
                + "Content-Disposition: form-data; name=\"avatar\"; filename=\"me.png\"\r\n"
                + "Content-Type: image/png\r\n\r\n").getBytes(StandardCharsets.UTF_8));
        expected.writeBytes(image);
        expected.writeBytes("\r\n--TestBoundary--\r\n".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(expected.toByteArray(), request.getBody());
    }

    @Test
    public void partsInsideParametersAreParts() throws EncodingException {
        EncodedRequest request = encoder.encode(Http.Verb.PUT, SEARCH, ParameterType.MULTIPART_FORM_DATA,
                params("file", new FormDataPart("file", null, null, new byte[]{'x'})), null);
        String body = new String(request.getBody(), StandardCharsets.UTF_8);
        assertTrue(body.contains("name=\"file\"; filename=\"file\"\r\nContent-Type: application/octet-stream\r\n\r\nx\r\n"));
        assertTrue(body.endsWith("--TestBoundary--\r\n"));
    }

    @Test
    public void multipartErrors() {
        List<FormDataPart> emptyPart = Collections.singletonList(new FormDataPart("file", null, null, new byte[0]));
        List<FormDataPart> unnamedPart = Collections.singletonList(new FormDataPart("", "a.bin", null, new byte[]{1}));

        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH,
                ParameterType.MULTIPART_FORM_DATA, null, null));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH,
                ParameterType.MULTIPART_FORM_DATA, null, emptyPart));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH,
                ParameterType.MULTIPART_FORM_DATA, null, unnamedPart));
        assertThrows(EncodingException.class, () -> encoder.encode(Http.Verb.POST, SEARCH,
                ParameterType.MULTIPART_FORM_DATA, "just a string", null));
    }

    @Test
    public void newBoundaryForEveryRequest() throws EncodingException {
        ParameterEncoder random = new ParameterEncoder();
        String first = random.encode(Http.Verb.POST, SEARCH, ParameterType.MULTIPART_FORM_DATA, params("a", 1), null)
                .getHeaders().getContentType();
        String second = random.encode(Http.Verb.POST, SEARCH, ParameterType.MULTIPART_FORM_DATA, params("a", 1), null)
                .getHeaders().getContentType();
        assertTrue(first.startsWith("multipart/form-data; boundary=Boundary-"));
        assertNotEquals(first, second);
    }

    @Test
    public void resolvesEffectiveType() {
        List<FormDataPart> parts = Collections.singletonList(FormDataPart.jpeg("photo", null, new byte[]{1}));

        assertEquals(ParameterType.MULTIPART_FORM_DATA, ParameterType.resolve(Http.Verb.POST, ParameterType.JSON, null, parts));
        assertEquals(ParameterType.MULTIPART_FORM_DATA, ParameterType.resolve(Http.Verb.GET, ParameterType.NONE, null, parts));
        assertEquals(ParameterType.NONE, ParameterType.resolve(Http.Verb.GET, ParameterType.FORM_URL_ENCODED, null, null));
        assertEquals(ParameterType.NONE, ParameterType.resolve(Http.Verb.DELETE, ParameterType.JSON, null, Collections.emptyList()));
        assertEquals(ParameterType.FORM_URL_ENCODED, ParameterType.resolve(Http.Verb.GET, ParameterType.FORM_URL_ENCODED, params("a", 1), null));
        assertEquals(ParameterType.JSON, ParameterType.resolve(Http.Verb.POST, ParameterType.JSON, null, null));
        assertEquals(ParameterType.NONE, ParameterType.resolve(Http.Verb.PUT, null, params("a", 1), null));
    }
}
