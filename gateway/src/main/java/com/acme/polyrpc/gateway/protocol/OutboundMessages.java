package com.acme.polyrpc.gateway.protocol;

import com.acme.polyrpc.gateway.term.Term;
import com.acme.polyrpc.gateway.term.TermCodec;

/**
 * Encoded replies the gateway produces itself. Call responses are forwarded from
 * workers untouched and never pass through here.
 */
public final class OutboundMessages {
    private static final byte[] NOREPLY = TermCodec.encode(Term.tuple(Term.atom("noreply")));

    private OutboundMessages() {
    }

    /** {@code {reply, <<Payload>>}} */
    public static byte[] reply(String payload) {
        return TermCodec.encode(Term.tuple(Term.atom("reply"), Term.binary(payload)));
    }

    /** {@code {noreply}} */
    public static byte[] noreply() {
        return NOREPLY.clone();
    }
}
