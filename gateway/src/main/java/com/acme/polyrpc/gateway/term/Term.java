package com.acme.polyrpc.gateway.term;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decoded term value. Only the shapes the gateway protocol needs are modelled;
 * everything else is rejected by {@link TermCodec}.
 */
public sealed interface Term permits Term.Atom, Term.Int, Term.Float, Term.Bin, Term.Tuple, Term.ListTerm {

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Int integer(long value) {
        return new Int(value);
    }

    static Bin binary(byte[] bytes) {
        return new Bin(bytes);
    }

    static Bin binary(String utf8) {
        return new Bin(utf8.getBytes(StandardCharsets.UTF_8));
    }

    static Tuple tuple(Term... elements) {
        return new Tuple(List.of(elements));
    }

    static ListTerm list(Term... elements) {
        return new ListTerm(List.of(elements));
    }

    record Atom(String name) implements Term {
        public Atom {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Int(long value) implements Term {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Float(double value) implements Term {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * Binary payload. The array is owned by the term and must not be mutated.
     */
    record Bin(byte[] bytes) implements Term {
        public Bin {
            Objects.requireNonNull(bytes, "bytes");
        }

        public String utf8() {
            return new String(bytes, StandardCharsets.UTF_8);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bin other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "<<" + bytes.length + " bytes>>";
        }
    }

    record Tuple(List<Term> elements) implements Term {
        public Tuple {
            elements = List.copyOf(elements);
        }

        public int arity() {
            return elements.size();
        }

        public Term get(int index) {
            return elements.get(index);
        }

        /** True when the first element is the atom {@code tag}. */
        public boolean isTagged(String tag) {
            return !elements.isEmpty()
                && elements.get(0) instanceof Atom first
                && first.name().equals(tag);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(elements.get(i));
            }
            return sb.append('}').toString();
        }
    }

    /**
     * Proper list. The empty list doubles as nil.
     */
    record ListTerm(List<Term> elements) implements Term {
        public ListTerm {
            elements = List.copyOf(elements);
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }
}
