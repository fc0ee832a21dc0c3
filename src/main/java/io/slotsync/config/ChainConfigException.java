package io.slotsync.config;

public class ChainConfigException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ChainConfigException() {
    }

    public ChainConfigException(String s) {
        super(s);
    }

    public ChainConfigException(String s, Throwable throwable) {
        super(s, throwable);
    }

    public ChainConfigException(Throwable throwable) {
        super(throwable);
    }
}
