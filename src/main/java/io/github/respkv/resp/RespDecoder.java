package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RESP协议增量解码器，使用{@link ByteBuf}缓存未解码的数据。
 * 每次喂入任意长度的数据块，完整的数据帧通过{@link #get()}取出。
 * @author zy
 */
public class RespDecoder {
    // 与redis的proto-max-bulk-len默认值一致
    static final int MAX_BULK_LENGTH      = 512 * 1024 * 1024;
    static final int MAX_AGGREGATE_LENGTH = 1024 * 1024;
    static final int MAX_NESTING_DEPTH    = 64;

    private enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY,
        MAP;

        static Type of(char c) throws RespDecodeException {
            switch (c) {
                case RespSimpleString.firstChar:
                    return SIMPLE_STRING;
                case RespError.firstChar:
                    return ERROR;
                case RespInteger.firstChar:
                    return INTEGER;
                case RespBulkString.firstChar:
                    return BULK_STRING;
                case RespArray.firstChar:
                    return ARRAY;
                case RespMap.firstChar:
                    return MAP;
                default:
                    throw new RespDecodeException("unknown resp type: 0x" + Integer.toHexString(c & 0xff));
            }
        }
    }

    private enum State {
        DECODE_TYPE,
        DECODE_INLINE, // SIMPLE_STRING, ERROR, INTEGER
        DECODE_LENGTH, // BULK_STRING, ARRAY, MAP
        DECODE_BULK_STRING_CONTENT,
    }

    // 聚合array和map的元素，map的元素个数是pair数的两倍
    private static class Aggregator {
        private final Type           type;
        private final int            len;
        private final List<RespData> children = new ArrayList<>();

        Aggregator(Type type, int len) {
            this.type = type;
            this.len = type == Type.MAP ? len * 2 : len;
        }

        void addData(RespData child) {
            children.add(child);
        }

        boolean isFinished() {
            return children.size() == len;
        }

        RespData build() {
            if (type == Type.ARRAY) {
                return RespArray.with(children);
            }
            Map<RespData, RespData> entries = new LinkedHashMap<>();
            for (int i = 0; i < children.size(); i += 2) {
                entries.put(children.get(i), children.get(i + 1));
            }
            return RespMap.with(entries);
        }
    }

    private Type                   type;
    private State                  state       = State.DECODE_TYPE;
    private int                    bulkLength  = -1;
    private final ByteBuf          byteBuf     = ByteBuf.allocate(512);
    private final Deque<Aggregator> aggregators = new ArrayDeque<>();
    private final List<RespData>   messages    = new ArrayList<>();

    public static RespDecoder create() {
        return new RespDecoder();
    }

    public RespDecoder decode(byte[] bytes) throws RespDecodeException {
        byteBuf.writeBytes(bytes);
        decode0();
        return this;
    }

    public RespDecoder decode(ByteBuffer buf) throws RespDecodeException {
        byteBuf.writeBytes(buf);
        decode0();
        return this;
    }

    /**
     * @return 完整解码的下一个数据帧，没有返回null
     */
    public <T extends RespData> T get() {
        return messages.isEmpty() ? null : (T) messages.remove(0);
    }

    /**
     * @return 是否有已收到但还不完整的数据帧
     */
    public boolean hasPartialFrame() {
        return byteBuf.isReadable() || state != State.DECODE_TYPE || !aggregators.isEmpty();
    }

    private void decode0() throws RespDecodeException {
        try {
            for (; ; ) {
                switch (state) {
                    case DECODE_TYPE:
                        if (!byteBuf.isReadable()) {
                            return;
                        }
                        type = Type.of((char) byteBuf.readByte());
                        state = type == Type.BULK_STRING || type == Type.ARRAY || type == Type.MAP
                                ? State.DECODE_LENGTH : State.DECODE_INLINE;
                        break;
                    case DECODE_INLINE:
                        RespData inline = decodeInline();
                        if (inline == null) {
                            return;
                        }
                        addMessage(inline);
                        break;
                    case DECODE_LENGTH:
                        String line = readLine();
                        if (line == null) {
                            return;
                        }
                        decodeLength(parseLength(line));
                        break;
                    case DECODE_BULK_STRING_CONTENT:
                        RespBulkString bulkString = decodeBulkString();
                        if (bulkString == null) {
                            return;
                        }
                        addMessage(bulkString);
                        break;
                    default:
                        throw new RespDecodeException("unknown decode state: " + state);
                }
            }
        } finally {
            byteBuf.discardReadBytes();
        }
    }

    private void decodeLength(int length) throws RespDecodeException {
        if (length < -1) {
            throw new RespDecodeException("invalid length: " + length);
        }
        if (type == Type.BULK_STRING) {
            if (length > MAX_BULK_LENGTH) {
                throw new RespDecodeException("bulk string too long: " + length);
            }
            if (length == -1) {
                addMessage(RespBulkString.nullBulkString());
            } else {
                bulkLength = length;
                state = State.DECODE_BULK_STRING_CONTENT;
            }
            return;
        }
        // null array当作空array
        if (length <= 0) {
            addMessage(type == Type.ARRAY ? RespArray.empty() : RespMap.with(new LinkedHashMap<>()));
            return;
        }
        if (length > MAX_AGGREGATE_LENGTH) {
            throw new RespDecodeException("too many elements: " + length);
        }
        if (aggregators.size() >= MAX_NESTING_DEPTH) {
            throw new RespDecodeException("nesting too deep, max depth: " + MAX_NESTING_DEPTH);
        }
        aggregators.push(new Aggregator(type, length));
        state = State.DECODE_TYPE;
    }

    private RespBulkString decodeBulkString() throws RespDecodeException {
        if (byteBuf.readableBytes() < (long) bulkLength + 2) {
            return null;
        }
        byte[] bytes = new byte[bulkLength];
        byteBuf.readBytes(bytes);
        if (byteBuf.readByte() != '\r' || byteBuf.readByte() != '\n') {
            throw new RespDecodeException("bulk string is not terminated by CRLF");
        }
        return RespBulkString.with(bytes);
    }

    private RespData decodeInline() throws RespDecodeException {
        String s = readLine();
        if (s == null) {
            return null;
        }
        switch (type) {
            case SIMPLE_STRING:
                return RespSimpleString.withUTF8(s);
            case ERROR:
                return RespError.withUTF8(s);
            case INTEGER:
                try {
                    return RespInteger.with(s);
                } catch (NumberFormatException e) {
                    throw new RespDecodeException("invalid integer: " + s, e);
                }
            default:
                throw new RespDecodeException("not inline type: " + type);
        }
    }

    private String readLine() throws RespDecodeException {
        int i = byteBuf.indexOf(byteBuf.getReaderIndex(), byteBuf.getWriterIndex(), (byte) '\n');
        if (i == -1) {
            return null;
        }
        if (i == byteBuf.getReaderIndex() || byteBuf.getByte(i - 1) != '\r') {
            throw new RespDecodeException("not found \\r in line");
        }

        byte[] bytes = new byte[i - 1 - byteBuf.getReaderIndex()];
        byteBuf.readBytes(bytes);
        byteBuf.readByte();
        byteBuf.readByte();
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private int parseLength(String line) throws RespDecodeException {
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException e) {
            throw new RespDecodeException("invalid length: " + line, e);
        }
    }

    private void addMessage(RespData data) {
        state = State.DECODE_TYPE;
        bulkLength = -1;
        while (!aggregators.isEmpty()) {
            Aggregator aggregator = aggregators.getFirst();
            aggregator.addData(data);
            if (!aggregator.isFinished()) {
                return;
            }
            aggregators.pop();
            data = aggregator.build();
        }
        messages.add(data);
    }
}
