package rs.lukaj.networking.params;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary part of a multipart/form-data request, e.g. an uploaded image.
 */
public class FormDataPart {
    public static final String PNG = "image/png";
    public static final String JPEG = "image/jpeg";
    public static final String OCTET_STREAM = "application/octet-stream";

    private final String fieldName;
    private final String filename;
    private final String contentType;
    private final byte[] data;

    /**
     * @param fieldName name of the form field
     * @param filename filename sent to the server; if null, fieldName is used
     * @param contentType content type of the data; if null, {@link #OCTET_STREAM}
     * @param data contents of the part
     */
    public FormDataPart(String fieldName, String filename, String contentType, byte[] data) {
        this.fieldName = fieldName;
        this.filename = filename == null ? fieldName : filename;
        this.contentType = contentType == null ? OCTET_STREAM : contentType;
        this.data = data;
    }

    public static FormDataPart png(String fieldName, String filename, byte[] data) {
        return new FormDataPart(fieldName, filename, PNG, data);
    }

    public static FormDataPart jpeg(String fieldName, String filename, byte[] data) {
        return new FormDataPart(fieldName, filename, JPEG, data);
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof FormDataPart)) return false;
        FormDataPart other = (FormDataPart) obj;
        return Objects.equals(fieldName, other.fieldName) && Objects.equals(filename, other.filename)
                && contentType.equals(other.contentType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, filename, contentType) * 31 + Arrays.hashCode(data);
    }
}
