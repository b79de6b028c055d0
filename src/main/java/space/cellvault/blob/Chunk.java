package space.cellvault.blob;

import java.nio.ByteBuffer;

/**
 * A contiguous byte range stored inside one block.
 * <p>
 * The payload's remaining bytes at construction are the chunk content. Size
 * and end are fixed then; consumers should still read the payload through
 * {@link ByteBuffer#duplicate()} or absolute access so that other readers of
 * the same chunk see an untouched position.
 */
public final class Chunk {

    private final long block;
    private final long offset;
    private final int size;
    private final ByteBuffer payload;

    public Chunk(long block, long offset, ByteBuffer payload) {
        this.block = block;
        this.offset = offset;
        this.size = payload.remaining();
        this.payload = payload;
    }

    public long block() {
        return block;
    }

    public long offset() {
        return offset;
    }

    public int size() {
        return size;
    }

    public ByteBuffer payload() {
        return payload;
    }

    /**
     * Offset of the first byte after this chunk.
     */
    public long end() {
        return offset + size();
    }
}
