package com.ownding.protect.common;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;

public class DecodingException extends ProtectException {

    private final String resource;
    private final String fieldPath;
    private final int line;
    private final int column;

    public DecodingException(String resource, String detail, String fieldPath, int line, int column, Throwable cause) {
        super(buildMessage(resource, detail, fieldPath, line, column), cause);
        this.resource = resource;
        this.fieldPath = fieldPath;
        this.line = line;
        this.column = column;
    }

    public static DecodingException from(String resource, IOException ex) {
        if (ex instanceof JsonProcessingException jsonEx) {
            JsonLocation location = jsonEx.getLocation();
            String fieldPath = jsonEx instanceof JsonMappingException mappingEx ? mappingEx.getPathReference() : null;
            return new DecodingException(
                    resource,
                    jsonEx.getOriginalMessage(),
                    fieldPath,
                    location == null ? -1 : location.getLineNr(),
                    location == null ? -1 : location.getColumnNr(),
                    ex);
        }
        return new DecodingException(resource, ex.getMessage(), null, -1, -1, ex);
    }

    public String getResource() {
        return resource;
    }

    /**
     * Jackson path reference such as {@code java.util.ArrayList[1]->Camera["micVolume"]}, or null.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String buildMessage(String resource, String detail, String fieldPath, int line, int column) {
        StringBuilder message = new StringBuilder("Failed to decode ").append(resource).append(": ").append(detail);
        if (fieldPath != null && !fieldPath.isBlank()) {
            message.append(" (path ").append(fieldPath).append(')');
        }
        if (line > 0) {
            message.append(" at line ").append(line).append(", column ").append(column);
        }
        return message.toString();
    }
}
