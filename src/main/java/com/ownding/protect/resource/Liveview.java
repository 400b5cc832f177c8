package com.ownding.protect.resource;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ownding.protect.common.TextFormat;

import java.util.List;

public record Liveview(
        String id,
        String name,
        @JsonProperty("isDefault") boolean defaultView,
        @JsonProperty("isGlobal") boolean global,
        String owner,
        int layout,
        List<Slot> slots
) implements ProtectFetchable {

    public static final String URL_SUFFIX = "liveviews";
    public static final String CSV_HEADER = "name,id,isDefault,isGlobal,owner,layout";

    public Liveview {
        slots = List.copyOf(slots);
    }

    @Override
    public String description() {
        return TextFormat.padded(name, 17) + " <" + id + "> " + (defaultView ? "(default)" : "");
    }

    @Override
    public String csvRow() {
        return name + "," + id + "," + defaultView + "," + global + "," + owner + "," + layout;
    }
}
