package com.ownding.protect.common;

/**
 * A named resource could not be resolved where the caller needs it to exist.
 * Plain lookups report absence with an empty result instead.
 */
public class ResourceNotFoundException extends ProtectException {

    private final String kind;
    private final String key;

    public ResourceNotFoundException(String kind, String key) {
        super(kind + " '" + key + "' not found");
        this.kind = kind;
        this.key = key;
    }

    public String getKind() {
        return kind;
    }

    public String getKey() {
        return key;
    }
}
