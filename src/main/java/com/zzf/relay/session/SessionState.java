package com.zzf.relay.session;

public enum SessionState {
    INIT,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED,
    CLEANED_UP;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
