package com.labpulse.stream;

/**
 * One serialized server-sent event. A null name marks a comment line used as keep-alive.
 *
 * @param name event name, or null for a comment
 * @param data JSON data, or the comment text
 */
public record StreamEvent(String name, String data) {

    public static StreamEvent keepAlive() {
        return new StreamEvent(null, "keep-alive");
    }

    public boolean isComment() {
        return name == null;
    }
}
