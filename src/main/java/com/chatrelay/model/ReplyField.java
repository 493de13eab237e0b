package com.chatrelay.model;

/**
 * One titled block of a reply, rendered side by side when inline.
 */
public record ReplyField(String name, String value, boolean inline) {

    public static ReplyField of(String name, String value) {
        return new ReplyField(name, value, true);
    }

    public static ReplyField fullWidth(String name, String value) {
        return new ReplyField(name, value, false);
    }
}
