package com.zzf.relay.session;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the agent session id last used in each channel so follow-up mentions continue the
 * same conversation. In memory only.
 */
@Component
public class ChannelSessionStore {

    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    public Optional<String> get(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(channelId));
    }

    public void put(String channelId, String sessionId) {
        if (channelId == null || sessionId == null || sessionId.isBlank()) {
            return;
        }
        sessions.put(channelId, sessionId);
    }

    public void clear(String channelId) {
        if (channelId != null) {
            sessions.remove(channelId);
        }
    }

    public int size() {
        return sessions.size();
    }
}
