package com.example.pairprog.message;

/** A client frame that cannot be decoded or violates a payload precondition. Reported to the sender only. */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
