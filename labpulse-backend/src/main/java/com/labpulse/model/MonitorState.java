package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Name and up/down state of one item reported by a monitor-listing driver.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonitorState {
    private String name;
    private boolean up;

    public static MonitorState up(String name) {
        return new MonitorState(name, true);
    }

    public static MonitorState down(String name) {
        return new MonitorState(name, false);
    }

    public String getStatus() {
        return up ? "up" : "down";
    }
}
