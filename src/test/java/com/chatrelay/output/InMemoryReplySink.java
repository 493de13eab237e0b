package com.chatrelay.output;

import com.chatrelay.model.CommandReply;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryReplySink implements ReplySink {

    private final List<CommandReply> replies = new CopyOnWriteArrayList<>();

    @Override
    public void send(CommandReply reply) {
        replies.add(reply);
    }

    public List<CommandReply> replies() {
        return replies;
    }

    public CommandReply last() {
        return replies.get(replies.size() - 1);
    }
}
