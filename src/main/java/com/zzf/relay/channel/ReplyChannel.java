package com.zzf.relay.channel;

/**
 * Outbound side of one chat conversation. Implementations may throw on any call; the relay treats
 * every failure except {@link #reply} as cosmetic.
 */
public interface ReplyChannel {

    /**
     * Posts a plain message and returns a handle usable with {@link #edit} and {@link #delete}.
     */
    String send(String text);

    /**
     * Posts the progress message. Channels that can render a cancel button attach it for {@code cancelToken}.
     */
    default String sendProgress(String text, String cancelToken) {
        return send(text);
    }

    void edit(String handle, String text);

    void delete(String handle);

    /**
     * Replies to the originating message.
     */
    void reply(String text);

    void sendTyping();
}
