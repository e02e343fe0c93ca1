package io.mediarealm.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xE17A   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - UTF-8 JSON of one log entry (see {@link TxLog})
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xE17A;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Prefix a payload with its header, ready for append. */
    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /**
     * Parse a header. Returns the payload length, or -1 if the header is not
     * a valid record header (garbage or a record from another format).
     */
    static int payloadLength(ByteBuffer header) {
        header.order(ByteOrder.LITTLE_ENDIAN);
        short magic = header.getShort();
        byte ver = header.get();
        int len = header.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0) {
            return -1;
        }
        return len;
    }

    static int headerCrc(ByteBuffer header) {
        return header.order(ByteOrder.LITTLE_ENDIAN).getInt(7);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
