package com.acme.polyrpc.gateway.term;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * External term format codec (the subset spoken by BERT-RPC style clients).
 *
 * <p>Decoding is strict: unknown tags, improper lists, bignums wider than 64 bits
 * and trailing bytes are rejected with {@link TermDecodeException}. Encoding always
 * produces the compact forms (small integer, small tuple, UTF-8 atoms).</p>
 */
public final class TermCodec {
    static final int VERSION = 131;

    static final int NEW_FLOAT_EXT = 70;
    static final int SMALL_INTEGER_EXT = 97;
    static final int INTEGER_EXT = 98;
    static final int ATOM_EXT = 100;
    static final int SMALL_TUPLE_EXT = 104;
    static final int LARGE_TUPLE_EXT = 105;
    static final int NIL_EXT = 106;
    static final int STRING_EXT = 107;
    static final int LIST_EXT = 108;
    static final int BINARY_EXT = 109;
    static final int SMALL_BIG_EXT = 110;
    static final int LARGE_BIG_EXT = 111;
    static final int SMALL_ATOM_EXT = 115;
    static final int ATOM_UTF8_EXT = 118;
    static final int SMALL_ATOM_UTF8_EXT = 119;

    private static final int MAX_DEPTH = 512;

    private TermCodec() {
    }

    public static Term decode(byte[] bytes) throws TermDecodeException {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        if (!buf.isReadable()) {
            throw new TermDecodeException(0, "empty term");
        }
        int version = buf.readUnsignedByte();
        if (version != VERSION) {
            throw new TermDecodeException(0, "unsupported term version " + version);
        }
        Term term = read(buf, 0);
        if (buf.isReadable()) {
            throw new TermDecodeException(buf.readerIndex(), buf.readableBytes() + " trailing bytes");
        }
        return term;
    }

    public static byte[] encode(Term term) {
        ByteBuf out = Unpooled.buffer(64);
        try {
            out.writeByte(VERSION);
            write(out, term);
            return ByteBufUtil.getBytes(out);
        } finally {
            out.release();
        }
    }

    private static Term read(ByteBuf buf, int depth) throws TermDecodeException {
        if (depth > MAX_DEPTH) {
            throw new TermDecodeException(buf.readerIndex(), "term nesting too deep");
        }
        require(buf, 1);
        int start = buf.readerIndex();
        int tag = buf.readUnsignedByte();
        switch (tag) {
            case SMALL_INTEGER_EXT:
                require(buf, 1);
                return new Term.Int(buf.readUnsignedByte());
            case INTEGER_EXT:
                require(buf, 4);
                return new Term.Int(buf.readInt());
            case NEW_FLOAT_EXT:
                require(buf, 8);
                return new Term.Float(buf.readDouble());
            case ATOM_EXT:
                require(buf, 2);
                return readAtom(buf, buf.readUnsignedShort(), false);
            case SMALL_ATOM_EXT:
                require(buf, 1);
                return readAtom(buf, buf.readUnsignedByte(), false);
            case ATOM_UTF8_EXT:
                require(buf, 2);
                return readAtom(buf, buf.readUnsignedShort(), true);
            case SMALL_ATOM_UTF8_EXT:
                require(buf, 1);
                return readAtom(buf, buf.readUnsignedByte(), true);
            case SMALL_TUPLE_EXT:
                require(buf, 1);
                return new Term.Tuple(readElements(buf, buf.readUnsignedByte(), depth));
            case LARGE_TUPLE_EXT:
                require(buf, 4);
                return new Term.Tuple(readElements(buf, buf.readUnsignedInt(), depth));
            case NIL_EXT:
                return new Term.ListTerm(List.of());
            case STRING_EXT:
                return readString(buf);
            case LIST_EXT: {
                require(buf, 4);
                List<Term> elements = readElements(buf, buf.readUnsignedInt(), depth);
                require(buf, 1);
                int tail = buf.readUnsignedByte();
                if (tail != NIL_EXT) {
                    throw new TermDecodeException(buf.readerIndex() - 1, "improper list");
                }
                return new Term.ListTerm(elements);
            }
            case BINARY_EXT: {
                require(buf, 4);
                int len = checkedLength(buf, buf.readUnsignedInt());
                byte[] data = new byte[len];
                buf.readBytes(data);
                return new Term.Bin(data);
            }
            case SMALL_BIG_EXT:
                require(buf, 1);
                return readBig(buf, buf.readUnsignedByte(), start);
            case LARGE_BIG_EXT:
                require(buf, 4);
                return readBig(buf, buf.readUnsignedInt(), start);
            default:
                throw new TermDecodeException(start, "unsupported tag " + tag);
        }
    }

    private static Term.Atom readAtom(ByteBuf buf, int len, boolean utf8) throws TermDecodeException {
        require(buf, len);
        String name = buf.readCharSequence(len, utf8 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1).toString();
        return new Term.Atom(name);
    }

    private static Term.ListTerm readString(ByteBuf buf) throws TermDecodeException {
        require(buf, 2);
        int len = buf.readUnsignedShort();
        require(buf, len);
        List<Term> chars = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            chars.add(new Term.Int(buf.readUnsignedByte()));
        }
        return new Term.ListTerm(chars);
    }

    private static List<Term> readElements(ByteBuf buf, long count, int depth) throws TermDecodeException {
        // every element takes at least one byte
        int n = checkedLength(buf, count);
        List<Term> elements = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            elements.add(read(buf, depth + 1));
        }
        return elements;
    }

    private static Term.Int readBig(ByteBuf buf, long digits, int start) throws TermDecodeException {
        if (digits > 8) {
            throw new TermDecodeException(start, "integer wider than 64 bits");
        }
        require(buf, 1 + (int) digits);
        int sign = buf.readUnsignedByte();
        long magnitude = 0L;
        for (int i = 0; i < digits; i++) {
            magnitude |= ((long) buf.readUnsignedByte()) << (8 * i);
        }
        if (magnitude < 0L) {
            if (sign != 0 && magnitude == Long.MIN_VALUE) {
                return new Term.Int(Long.MIN_VALUE);
            }
            throw new TermDecodeException(start, "integer wider than 64 bits");
        }
        return new Term.Int(sign == 0 ? magnitude : -magnitude);
    }

    private static void require(ByteBuf buf, int n) throws TermDecodeException {
        if (buf.readableBytes() < n) {
            throw new TermDecodeException(buf.readerIndex(), "truncated term, need " + n + " bytes");
        }
    }

    private static int checkedLength(ByteBuf buf, long len) throws TermDecodeException {
        if (len > buf.readableBytes()) {
            throw new TermDecodeException(buf.readerIndex(), "length " + len + " exceeds remaining input");
        }
        return (int) len;
    }

    private static void write(ByteBuf out, Term term) {
        if (term instanceof Term.Atom atom) {
            writeAtom(out, atom.name());
        } else if (term instanceof Term.Int i) {
            writeInt(out, i.value());
        } else if (term instanceof Term.Float f) {
            out.writeByte(NEW_FLOAT_EXT);
            out.writeDouble(f.value());
        } else if (term instanceof Term.Bin bin) {
            out.writeByte(BINARY_EXT);
            out.writeInt(bin.bytes().length);
            out.writeBytes(bin.bytes());
        } else if (term instanceof Term.Tuple tuple) {
            int arity = tuple.arity();
            if (arity <= 0xFF) {
                out.writeByte(SMALL_TUPLE_EXT);
                out.writeByte(arity);
            } else {
                out.writeByte(LARGE_TUPLE_EXT);
                out.writeInt(arity);
            }
            for (Term element : tuple.elements()) {
                write(out, element);
            }
        } else if (term instanceof Term.ListTerm list) {
            if (!list.elements().isEmpty()) {
                out.writeByte(LIST_EXT);
                out.writeInt(list.elements().size());
                for (Term element : list.elements()) {
                    write(out, element);
                }
            }
            out.writeByte(NIL_EXT);
        } else {
            throw new IllegalArgumentException("unsupported term " + term);
        }
    }

    private static void writeAtom(ByteBuf out, String name) {
        byte[] utf8 = name.getBytes(StandardCharsets.UTF_8);
        if (utf8.length <= 0xFF) {
            out.writeByte(SMALL_ATOM_UTF8_EXT);
            out.writeByte(utf8.length);
        } else if (utf8.length <= 0xFFFF) {
            out.writeByte(ATOM_UTF8_EXT);
            out.writeShort(utf8.length);
        } else {
            throw new IllegalArgumentException("atom too long: " + utf8.length + " bytes");
        }
        out.writeBytes(utf8);
    }

    private static void writeInt(ByteBuf out, long value) {
        if (value >= 0 && value <= 0xFF) {
            out.writeByte(SMALL_INTEGER_EXT);
            out.writeByte((int) value);
            return;
        }
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            out.writeByte(INTEGER_EXT);
            out.writeInt((int) value);
            return;
        }
        // Long.MIN_VALUE negates to itself; the unsigned shifts below still emit 2^63
        long magnitude = value < 0 ? -value : value;
        int digits = (64 - Long.numberOfLeadingZeros(magnitude) + 7) / 8;
        out.writeByte(SMALL_BIG_EXT);
        out.writeByte(digits);
        out.writeByte(value < 0 ? 1 : 0);
        for (int i = 0; i < digits; i++) {
            out.writeByte((int) ((magnitude >>> (8 * i)) & 0xFF));
        }
    }
}
