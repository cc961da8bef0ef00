package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResult {

    public enum Status {
        SUCCESS,
        FAILED
    }

    private Status status;
    private byte[] payload;
    private int attempts;
    private String error;

    public static FetchResult success(byte[] payload, int attempts) {
        return FetchResult.builder().status(Status.SUCCESS).payload(payload).attempts(attempts).build();
    }

    public static FetchResult failed(String error, int attempts) {
        return FetchResult.builder().status(Status.FAILED).attempts(attempts).error(error).build();
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
