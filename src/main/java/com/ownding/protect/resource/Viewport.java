package com.ownding.protect.resource;

import com.ownding.protect.common.TextFormat;

/**
 * A Protect viewer display. {@code liveview} is the id of the liveview it currently shows.
 */
public record Viewport(
        String id,
        String name,
        String liveview,
        String state,
        int streamLimit
) implements ProtectFetchable {

    public static final String URL_SUFFIX = "viewers";
    public static final String CSV_HEADER = "name,id,liveview,state,streamLimit";

    @Override
    public String description() {
        return TextFormat.padded(name, 17) + " <" + id + "> (viewing '" + liveview + "')";
    }

    @Override
    public String csvRow() {
        return name + "," + id + "," + liveview + "," + state + "," + streamLimit;
    }
}
