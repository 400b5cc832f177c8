package com.ownding.protect.resource;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ownding.protect.common.TextFormat;

public record Camera(
        String id,
        String name,
        String state,
        @JsonProperty("isMicEnabled") boolean micEnabled,
        int micVolume,
        String videoMode,
        String hdrType
) implements ProtectFetchable {

    public static final String URL_SUFFIX = "cameras";
    public static final String CSV_HEADER = "name,id,state,isMicEnabled,micVolume,videoMode,hdrType";

    @Override
    public String description() {
        return TextFormat.padded(name, 17) + " <" + id + "> [" + state + "]";
    }

    @Override
    public String csvRow() {
        return name + "," + id + "," + state + "," + micEnabled + "," + micVolume + "," + videoMode + "," + hdrType;
    }
}
