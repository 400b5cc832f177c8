package com.ownding.protect.resource;

import java.util.List;

/**
 * One layout cell of a liveview; {@code cameras} are camera ids cycled every {@code cycleInterval} seconds.
 */
public record Slot(
        List<String> cameras,
        String cycleMode,
        int cycleInterval
) {
    public Slot {
        cameras = List.copyOf(cameras);
    }
}
