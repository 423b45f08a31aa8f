package com.zzf.relay.session;

import com.zzf.relay.channel.ReplyChannel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Records every chat operation; individual operations can be told to fail.
 */
class RecordingReplyChannel implements ReplyChannel {

    final List<String> operations = new ArrayList<>();
    final AtomicInteger typingCount = new AtomicInteger();
    final AtomicInteger handles = new AtomicInteger();
    volatile String lastCancelToken;
    volatile boolean failEdits;
    volatile boolean failEverything;

    @Override
    public synchronized String send(String text) {
        maybeFail();
        operations.add("send:" + text);
        return "msg-" + handles.incrementAndGet();
    }

    @Override
    public synchronized String sendProgress(String text, String cancelToken) {
        lastCancelToken = cancelToken;
        maybeFail();
        operations.add("progress:" + text);
        return "progress-" + handles.incrementAndGet();
    }

    @Override
    public synchronized void edit(String handle, String text) {
        if (failEdits) {
            throw new IllegalStateException("edit rejected");
        }
        maybeFail();
        operations.add("edit:" + handle + ":" + text);
    }

    @Override
    public synchronized void delete(String handle) {
        maybeFail();
        operations.add("delete:" + handle);
    }

    @Override
    public synchronized void reply(String text) {
        maybeFail();
        operations.add("reply:" + text);
    }

    @Override
    public void sendTyping() {
        typingCount.incrementAndGet();
        maybeFail();
    }

    synchronized List<String> operationsStartingWith(String prefix) {
        return operations.stream().filter(op -> op.startsWith(prefix)).collect(Collectors.toList());
    }

    private void maybeFail() {
        if (failEverything) {
            throw new IllegalStateException("channel unavailable");
        }
    }
}
