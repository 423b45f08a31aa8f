package com.zzf.relay.channel;

public class RelayChannelException extends RuntimeException {
    public RelayChannelException(String message) {
        super(message);
    }

    public RelayChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
