package org.dxworks.lexframe;

public class LexframeException extends RuntimeException {

    public LexframeException(String message) {
        super(message);
    }

    public LexframeException(String message, Throwable cause) {
        super(message, cause);
    }
}
