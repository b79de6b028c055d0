package space.cellvault.blob;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Interface for the cell-oriented backends that hold object data.
 * <p>
 * Data is laid out in blocks, each identified by the object offset it starts
 * at, and every block holds contiguous chunks no larger than
 * {@link #maxChunkSize(ObjectDescriptor)}. Implementations report I/O faults
 * as {@link space.cellvault.common.exception.BlobStoreException}.
 */
public interface BlobStore {

    /**
     * List the block ids of an object.
     *
     * @param descriptor The object.
     * @return The block ids in ascending order.
     */
    List<Long> blocks(ObjectDescriptor descriptor);

    /**
     * Fetch the next page of chunks of a block.
     *
     * @param descriptor The object.
     * @param block      The block id.
     * @param fromOffset The object offset to start at.
     * @return Chunks at or after {@code fromOffset} in ascending offset order, or
     *         an empty list once the block is exhausted.
     */
    List<Chunk> chunks(ObjectDescriptor descriptor, long block, long fromOffset);

    /**
     * Open a block for writing.
     *
     * @param descriptor The object.
     * @param block      The block id.
     * @param offset     The object offset of the block's first chunk.
     */
    void startBlock(ObjectDescriptor descriptor, long block, long offset);

    /**
     * Persist a chunk.
     *
     * @param descriptor The object.
     * @param block      The block id.
     * @param offset     The object offset of the chunk.
     * @param payload    The remaining bytes to store; its position is not moved.
     * @return The number of bytes actually stored, at most
     *         {@code payload.remaining()}.
     */
    int writeChunk(ObjectDescriptor descriptor, long block, long offset, ByteBuffer payload);

    /**
     * The largest chunk this store currently accepts for the object.
     */
    int maxChunkSize(ObjectDescriptor descriptor);

    /**
     * Whether a block that has been filled up to {@code offset} is full.
     */
    boolean isBoundary(long block, long offset);
}
