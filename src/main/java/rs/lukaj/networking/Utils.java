package rs.lukaj.networking;


import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.zip.*;

//you know, other stuff
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Mapper used for every JSON body and response. ObjectMapper is thread-safe once configured.
     * @return shared ObjectMapper instance
     */
    public static ObjectMapper jsonMapper() {
        return mapper;
    }

    /**
     * Decompresses gzip- or deflate-encoded byte array. Encoding should be one of "gzip" or "deflate". If encoding is
     * "identity" or null, the data array is returned. In all other cases, the array is returned and warning is
     * logged
     * @param data data to decompress
     * @param encoding encoding
     * @return decompressed bytes
     * @throws IOException if {@link GZIPInputStream} throws IOException
     */
    //only gzip and deflate have decoders in the standard library
    public static byte[] decompress(byte[] data, String encoding) throws IOException {
        if(encoding == null || encoding.equalsIgnoreCase("identity")) {
            return data;
        } else if(encoding.equalsIgnoreCase("gzip") || encoding.equalsIgnoreCase("deflate")) {
            ByteArrayInputStream bytein = new ByteArrayInputStream(data);
            InputStream compressed;
            if(encoding.equalsIgnoreCase("gzip")) compressed = new GZIPInputStream(bytein);
            else compressed = new InflaterInputStream(bytein, new Inflater(false), 512);

            try(bytein; compressed) {
                return compressed.readAllBytes();
            }
        } else {
            logger.warn("Ignoring unknown encoding {}", encoding);
            return data;
        }
    }
}
