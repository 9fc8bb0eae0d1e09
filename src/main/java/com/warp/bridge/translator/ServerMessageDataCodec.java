package com.warp.bridge.translator;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * server_message_data 编解码
 * <p>
 * 内容是一个 proto3 消息：field 1 为 UUID 字符串，field 3 为 google.protobuf.Timestamp
 * （field 1 = seconds，field 2 = nanos）。外层用 URL-safe Base64 且去掉填充
 */
public final class ServerMessageDataCodec {

    private static final int WIRE_VARINT = 0;
    private static final int WIRE_FIXED64 = 1;
    private static final int WIRE_LENGTH_DELIMITED = 2;
    private static final int WIRE_FIXED32 = 5;

    private ServerMessageDataCodec() {
    }

    public static String encode(ServerMessageData data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (data.uuid() != null) {
            byte[] uuid = data.uuid().toString().getBytes(StandardCharsets.UTF_8);
            writeKey(out, 1, WIRE_LENGTH_DELIMITED);
            writeVarint(out, uuid.length);
            out.writeBytes(uuid);
        }
        if (data.timestamp() != null) {
            ByteArrayOutputStream ts = new ByteArrayOutputStream();
            writeKey(ts, 1, WIRE_VARINT);
            writeVarint(ts, data.timestamp().getEpochSecond());
            writeKey(ts, 2, WIRE_VARINT);
            writeVarint(ts, data.timestamp().getNano());
            byte[] tsBytes = ts.toByteArray();
            writeKey(out, 3, WIRE_LENGTH_DELIMITED);
            writeVarint(out, tsBytes.length);
            out.writeBytes(tsBytes);
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(out.toByteArray());
    }

    /**
     * 解码，兼容缺失的填充以及标准 Base64 字母表
     *
     * @throws IllegalArgumentException 非法 Base64 或 protobuf 结构
     */
    public static ServerMessageData decode(String encoded) {
        byte[] raw = Base64.getUrlDecoder().decode(restorePadding(encoded));
        Reader reader = new Reader(raw, 0, raw.length);

        UUID uuid = null;
        Instant timestamp = null;
        while (reader.hasRemaining()) {
            long key = reader.readVarint();
            int field = (int) (key >>> 3);
            int wireType = (int) (key & 0x07);
            if (wireType == WIRE_LENGTH_DELIMITED) {
                int length = (int) reader.readVarint();
                int start = reader.position;
                reader.skip(length);
                if (field == 1) {
                    uuid = UUID.fromString(new String(raw, start, length, StandardCharsets.UTF_8));
                } else if (field == 3) {
                    timestamp = decodeTimestamp(new Reader(raw, start, start + length));
                }
            } else {
                reader.skipField(wireType);
            }
        }
        return new ServerMessageData(uuid, timestamp);
    }

    static String restorePadding(String encoded) {
        String s = encoded.trim().replace('+', '-').replace('/', '_');
        int pad = (4 - s.length() % 4) % 4;
        return pad == 0 ? s : s + "=".repeat(pad);
    }

    private static Instant decodeTimestamp(Reader reader) {
        long seconds = 0;
        long nanos = 0;
        while (reader.hasRemaining()) {
            long key = reader.readVarint();
            int field = (int) (key >>> 3);
            int wireType = (int) (key & 0x07);
            if (wireType == WIRE_VARINT) {
                long value = reader.readVarint();
                if (field == 1) {
                    seconds = value;
                } else if (field == 2) {
                    nanos = value;
                }
            } else {
                reader.skipField(wireType);
            }
        }
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static void writeKey(ByteArrayOutputStream out, int field, int wireType) {
        writeVarint(out, ((long) field << 3) | wireType);
    }

    private static void writeVarint(ByteArrayOutputStream out, long value) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }

    private static final class Reader {
        private final byte[] buf;
        private final int limit;
        private int position;

        Reader(byte[] buf, int position, int limit) {
            this.buf = buf;
            this.position = position;
            this.limit = limit;
        }

        boolean hasRemaining() {
            return position < limit;
        }

        long readVarint() {
            long result = 0;
            for (int shift = 0; shift < 64; shift += 7) {
                if (position >= limit) {
                    throw new IllegalArgumentException("varint 截断");
                }
                byte b = buf[position++];
                result |= (long) (b & 0x7F) << shift;
                if ((b & 0x80) == 0) {
                    return result;
                }
            }
            throw new IllegalArgumentException("varint 过长");
        }

        void skip(int length) {
            if (length < 0 || position + length > limit) {
                throw new IllegalArgumentException("字段长度越界");
            }
            position += length;
        }

        void skipField(int wireType) {
            switch (wireType) {
                case WIRE_VARINT -> readVarint();
                case WIRE_FIXED64 -> skip(8);
                case WIRE_LENGTH_DELIMITED -> skip((int) readVarint());
                case WIRE_FIXED32 -> skip(4);
                default -> throw new IllegalArgumentException("未知 wire type: " + wireType);
            }
        }
    }
}
