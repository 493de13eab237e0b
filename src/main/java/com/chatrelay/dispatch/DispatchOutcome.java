package com.chatrelay.dispatch;

/**
 * What the dispatcher did with a message.
 */
public enum DispatchOutcome {
    /** Bot author, missing prefix or empty command. */
    IGNORED,
    UNKNOWN_COMMAND,
    SUCCEEDED,
    FAILED
}
