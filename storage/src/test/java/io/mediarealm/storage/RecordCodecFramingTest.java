package io.mediarealm.storage;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecFramingTest {

    @Test
    void header_carries_magic_length_and_crc() {
        byte[] payload = "{\"lsn\":1}".getBytes(StandardCharsets.UTF_8);
        byte[] framed = RecordCodec.frame(payload);

        assertEquals(RecordCodec.HEADER_BYTES + payload.length, framed.length);
        ByteBuffer hdr = ByteBuffer.wrap(framed, 0, RecordCodec.HEADER_BYTES).slice();
        assertEquals(payload.length, RecordCodec.payloadLength(hdr));
        assertEquals(RecordCodec.crc32(payload), RecordCodec.headerCrc(hdr));
    }

    @Test
    void garbage_header_is_rejected() {
        ByteBuffer hdr = ByteBuffer.wrap(new byte[RecordCodec.HEADER_BYTES]);
        assertEquals(-1, RecordCodec.payloadLength(hdr));
    }
}
