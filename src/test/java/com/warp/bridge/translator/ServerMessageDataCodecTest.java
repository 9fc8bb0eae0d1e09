package com.warp.bridge.translator;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ServerMessageDataCodecTest {

    @Test
    void encode_thenDecode_restoresUuidAndTimestamp() {
        UUID uuid = UUID.fromString("3f1c2a9e-6b4d-4f7a-9c55-0e2d8b1a7c40");
        Instant timestamp = Instant.ofEpochSecond(1_723_000_000L, 123_456_789);

        String encoded = ServerMessageDataCodec.encode(new ServerMessageData(uuid, timestamp));
        ServerMessageData decoded = ServerMessageDataCodec.decode(encoded);

        assertEquals(uuid, decoded.uuid());
        assertEquals(timestamp, decoded.timestamp());
    }

    @Test
    void encode_usesUrlSafeAlphabetWithoutPadding() {
        String encoded = ServerMessageDataCodec.encode(ServerMessageData.now(UUID.randomUUID()));

        assertFalse(encoded.contains("="));
        assertFalse(encoded.contains("+"));
        assertFalse(encoded.contains("/"));
    }

    @Test
    void decode_acceptsPaddedAndStandardAlphabetInput() {
        UUID uuid = UUID.randomUUID();
        Instant timestamp = Instant.ofEpochSecond(1_700_000_000L, 5);
        String encoded = ServerMessageDataCodec.encode(new ServerMessageData(uuid, timestamp));

        byte[] raw = Base64.getUrlDecoder().decode(ServerMessageDataCodec.restorePadding(encoded));
        String standard = Base64.getEncoder().encodeToString(raw);

        ServerMessageData decoded = ServerMessageDataCodec.decode(standard);
        assertEquals(uuid, decoded.uuid());
        assertEquals(timestamp, decoded.timestamp());
    }

    @Test
    void restorePadding_addsMissingPadding() {
        assertEquals("YQ==", ServerMessageDataCodec.restorePadding("YQ"));
        assertEquals("YWI=", ServerMessageDataCodec.restorePadding("YWI"));
        assertEquals("YWJj", ServerMessageDataCodec.restorePadding("YWJj"));
    }

    @Test
    void decode_skipsUnknownFields() {
        // field 2 varint 7, then field 1 = uuid
        UUID uuid = UUID.randomUUID();
        byte[] uuidBytes = uuid.toString().getBytes();
        byte[] raw = new byte[2 + 2 + uuidBytes.length];
        raw[0] = 0x10;
        raw[1] = 0x07;
        raw[2] = 0x0A;
        raw[3] = (byte) uuidBytes.length;
        System.arraycopy(uuidBytes, 0, raw, 4, uuidBytes.length);

        ServerMessageData decoded = ServerMessageDataCodec.decode(Base64.getUrlEncoder().withoutPadding().encodeToString(raw));

        assertEquals(uuid, decoded.uuid());
        assertNull(decoded.timestamp());
    }

    @Test
    void decode_truncatedInput_throws() {
        // field 1 length-delimited claims 36 bytes but only 2 follow
        byte[] raw = {0x0A, 0x24, 0x61, 0x62};
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);

        assertThrows(IllegalArgumentException.class, () -> ServerMessageDataCodec.decode(encoded));
    }
}
