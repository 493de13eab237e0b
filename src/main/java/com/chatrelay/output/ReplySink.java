package com.chatrelay.output;

import com.chatrelay.model.CommandReply;

/**
 * Outbound side of the relay: delivers replies to the chat gateway.
 */
public interface ReplySink {

    /**
     * Deliver a reply, blocking until it is accepted or the send fails.
     *
     * @param reply the reply to deliver
     * @throws com.chatrelay.error.RelayException if delivery fails
     */
    void send(CommandReply reply);
}
