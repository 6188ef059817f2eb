package org.rapidpll;

public class PLLConfigException extends RuntimeException {

    public PLLConfigException(String message) {
        super(message);
    }
}
