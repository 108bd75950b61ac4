package com.acme.polyrpc.gateway.protocol;

import com.acme.polyrpc.gateway.term.Term;

/**
 * Classified inbound frame. Decoded once at the connection boundary and matched
 * by type everywhere else.
 */
public sealed interface InboundMessage
    permits InboundMessage.AdminCall, InboundMessage.Info, InboundMessage.Action, InboundMessage.Unrecognized {

    /** {@code {call, '__admin__', Fun, Args}} */
    record AdminCall(String function, Term args) implements InboundMessage {}

    /** {@code {info, Command, Args}} */
    record Info(Term command, Term args) implements InboundMessage {}

    /** A request that has to run on a worker. */
    sealed interface Action extends InboundMessage permits Call, Cast {
        String module();
        String function();
        Term args();
    }

    /** {@code {call, Mod, Fun, Args}} */
    record Call(String module, String function, Term args) implements Action {}

    /** {@code {cast, Mod, Fun, Args}} */
    record Cast(String module, String function, Term args) implements Action {}

    record Unrecognized(Term term) implements InboundMessage {}
}
