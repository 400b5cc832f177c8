package com.ownding.protect.resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.ownding.protect.common.DecodingException;
import com.ownding.protect.common.JsonSupport;

import java.io.IOException;
import java.util.List;

/**
 * Static half of the fetchable capability: endpoint suffix, CSV header and the JSON array decoder
 * for one resource type.
 */
public final class ResourceKind<T extends ProtectFetchable> {

    public static final ResourceKind<Camera> CAMERA =
            new ResourceKind<>("Camera", Camera.URL_SUFFIX, Camera.CSV_HEADER, new TypeReference<List<Camera>>() {});
    public static final ResourceKind<Liveview> LIVEVIEW =
            new ResourceKind<>("Liveview", Liveview.URL_SUFFIX, Liveview.CSV_HEADER, new TypeReference<List<Liveview>>() {});
    public static final ResourceKind<Viewport> VIEWPORT =
            new ResourceKind<>("Viewport", Viewport.URL_SUFFIX, Viewport.CSV_HEADER, new TypeReference<List<Viewport>>() {});

    private final String displayName;
    private final String urlSuffix;
    private final String csvHeader;
    private final TypeReference<List<T>> listType;

    private ResourceKind(String displayName, String urlSuffix, String csvHeader, TypeReference<List<T>> listType) {
        this.displayName = displayName;
        this.urlSuffix = urlSuffix;
        this.csvHeader = csvHeader;
        this.listType = listType;
    }

    public String displayName() {
        return displayName;
    }

    public String urlSuffix() {
        return urlSuffix;
    }

    public String csvHeader() {
        return csvHeader;
    }

    /**
     * Decodes a JSON array into an unmodifiable list in payload order. Any malformed element
     * rejects the whole payload.
     *
     * @throws DecodingException when the payload is not an array of well formed elements
     */
    public List<T> decode(byte[] data) {
        List<T> decoded;
        try {
            decoded = JsonSupport.MAPPER.readValue(data, listType);
        } catch (IOException ex) {
            throw DecodingException.from(urlSuffix, ex);
        }
        if (decoded == null) {
            throw new DecodingException(urlSuffix, "expected a JSON array but got null", null, -1, -1, null);
        }
        for (int i = 0; i < decoded.size(); i++) {
            if (decoded.get(i) == null) {
                throw new DecodingException(urlSuffix, "null element", "[" + i + "]", -1, -1, null);
            }
        }
        return List.copyOf(decoded);
    }

    public String toCsv(List<T> items) {
        StringBuilder csv = new StringBuilder(csvHeader).append('\n');
        for (T item : items) {
            csv.append(item.csvRow()).append('\n');
        }
        return csv.toString();
    }

    @Override
    public String toString() {
        return urlSuffix;
    }
}
