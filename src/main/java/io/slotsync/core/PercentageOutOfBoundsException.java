package io.slotsync.core;

public class PercentageOutOfBoundsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public PercentageOutOfBoundsException() {
    }

    public PercentageOutOfBoundsException(String s) {
        super(s);
    }

    public PercentageOutOfBoundsException(String s, Throwable throwable) {
        super(s, throwable);
    }

    public PercentageOutOfBoundsException(Throwable throwable) {
        super(throwable);
    }
}
