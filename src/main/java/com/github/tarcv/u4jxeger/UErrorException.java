package com.github.tarcv.u4jxeger;

public class UErrorException extends RuntimeException {
    private final UErrorCode status;

    public UErrorException(UErrorCode status) {
        super(status.name());
        this.status = status;
    }

    public UErrorException(UErrorCode status, String message) {
        super(message);
        this.status = status;
    }

    public UErrorCode getErrorCode() {
        return status;
    }

    @Override
    public String toString() {
        return "UErrorException{" +
                "status=" + status +
                ", message=" + getMessage() +
                '}';
    }
}
