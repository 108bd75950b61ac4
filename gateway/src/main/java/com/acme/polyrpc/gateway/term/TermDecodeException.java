package com.acme.polyrpc.gateway.term;

public class TermDecodeException extends Exception {
    private final int position;

    public TermDecodeException(int position, String message) {
        super(message + " at offset " + position);
        this.position = position;
    }

    public int position() { return position; }
}
