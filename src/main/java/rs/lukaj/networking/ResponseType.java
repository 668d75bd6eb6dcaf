package rs.lukaj.networking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * What the response body is decoded into. Also part of the cache key: the same cache name can hold
 * a JSON document and an image at the same time without one being returned as the other.
 */
public enum ResponseType {
    JSON("application/json", JsonNode.class) {
        @Override
        public Object decode(byte[] data) throws DecodingException {
            if(data.length == 0) return MissingNode.getInstance(); //e.g. 204 No Content
            try {
                return Utils.jsonMapper().readTree(data);
            } catch (IOException e) {
                throw new DecodingException("Response isn't valid JSON", e);
            }
        }

        @Override
        public byte[] encode(Object object) throws IOException {
            if(((JsonNode) object).isMissingNode()) return new byte[0]; //Jackson would write it as null
            return Utils.jsonMapper().writeValueAsBytes(object);
        }
    },
    IMAGE("image/*", BufferedImage.class) {
        @Override
        public Object decode(byte[] data) throws DecodingException {
            BufferedImage image;
            try {
                image = ImageIO.read(new ByteArrayInputStream(data));
            } catch (IOException | RuntimeException e) { //some readers throw on truncated data
                throw new DecodingException("Cannot read image", e);
            }
            if(image == null) throw new DecodingException("Response isn't an image in any known format");
            return image;
        }

        @Override
        public byte[] encode(Object object) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            if(!ImageIO.write((BufferedImage) object, "png", out))
                throw new IOException("No PNG writer available");
            return out.toByteArray();
        }
    },
    DATA("*/*", byte[].class) {
        @Override
        public Object decode(byte[] data) {
            return data;
        }

        @Override
        public byte[] encode(Object object) {
            return (byte[]) object;
        }
    };

    private final String accept;
    private final Class<?> javaType;

    ResponseType(String accept, Class<?> javaType) {
        this.accept = accept;
        this.javaType = javaType;
    }

    /**
     * Decodes raw response body into the object of this type.
     * @param data response body, never null
     * @return decoded object, instance of {@link #getJavaType()}
     * @throws DecodingException if data doesn't represent an object of this type
     */
    public abstract Object decode(byte[] data) throws DecodingException;

    /**
     * Turns a decoded object back into bytes, so it can be stored in the file cache and decoded
     * later using {@link #decode(byte[])}.
     * @param object instance of {@link #getJavaType()}
     * @return bytes representing the object
     * @throws IOException if object can't be written
     */
    public abstract byte[] encode(Object object) throws IOException;

    /**
     * @return value of the Accept header sent when expecting this type
     */
    public String getAccept() {
        return accept;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    public boolean isInstance(Object object) {
        return javaType.isInstance(object);
    }
}
