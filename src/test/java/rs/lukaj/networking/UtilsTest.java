package rs.lukaj.networking;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {
    private static final byte[] TEXT = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);

    @Test
    public void gzip() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try(GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(TEXT);
        }
        assertArrayEquals(TEXT, Utils.decompress(out.toByteArray(), "gzip"));
        assertArrayEquals(TEXT, Utils.decompress(out.toByteArray(), "GZIP"));
    }

    @Test
    public void deflate() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try(DeflaterOutputStream deflate = new DeflaterOutputStream(out)) {
            deflate.write(TEXT);
        }
        assertArrayEquals(TEXT, Utils.decompress(out.toByteArray(), "deflate"));
    }

    @Test
    public void identityAndUnknown() throws IOException {
        assertSame(TEXT, Utils.decompress(TEXT, null));
        assertSame(TEXT, Utils.decompress(TEXT, "identity"));
        assertSame(TEXT, Utils.decompress(TEXT, "br"));
    }

    @Test
    public void corruptGzipThrows() {
        assertThrows(IOException.class, () -> Utils.decompress(TEXT, "gzip"));
    }
}
