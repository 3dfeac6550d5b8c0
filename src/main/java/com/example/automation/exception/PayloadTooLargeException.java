package com.example.automation.exception;

import lombok.Getter;

@Getter
public class PayloadTooLargeException extends RuntimeException {

    private final long size;
    private final long limit;

    public PayloadTooLargeException(long size, long limit) {
        super(String.format("Payload of %d bytes exceeds the limit of %d bytes", size, limit));
        this.size = size;
        this.limit = limit;
    }
}
