package com.acme.polyrpc.gateway.protocol;

import com.acme.polyrpc.gateway.term.Term;

public final class ProtocolClassifier {
    public static final String ADMIN_MODULE = "__admin__";

    private ProtocolClassifier() {
    }

    public static InboundMessage classify(Term term) {
        if (!(term instanceof Term.Tuple tuple)) {
            return new InboundMessage.Unrecognized(term);
        }
        if (tuple.arity() == 3 && tuple.isTagged("info")) {
            return new InboundMessage.Info(tuple.get(1), tuple.get(2));
        }
        if (tuple.arity() != 4 || !(tuple.get(1) instanceof Term.Atom module)) {
            return new InboundMessage.Unrecognized(term);
        }
        Term args = tuple.get(3);
        if (tuple.isTagged("call") && ADMIN_MODULE.equals(module.name())) {
            // any function term is an admin command; unknown ones get the not-supported reply
            String function = tuple.get(2) instanceof Term.Atom atom ? atom.name() : tuple.get(2).toString();
            return new InboundMessage.AdminCall(function, args);
        }
        if (!(tuple.get(2) instanceof Term.Atom function)) {
            return new InboundMessage.Unrecognized(term);
        }
        if (tuple.isTagged("call")) {
            return new InboundMessage.Call(module.name(), function.name(), args);
        }
        if (tuple.isTagged("cast")) {
            return new InboundMessage.Cast(module.name(), function.name(), args);
        }
        return new InboundMessage.Unrecognized(term);
    }
}
