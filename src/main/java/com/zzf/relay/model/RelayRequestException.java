package com.zzf.relay.model;

import lombok.Getter;

@Getter
public class RelayRequestException extends RuntimeException {
    private final String errorCode;

    public RelayRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
