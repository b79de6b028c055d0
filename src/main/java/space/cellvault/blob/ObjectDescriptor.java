package space.cellvault.blob;

import java.util.UUID;

/**
 * Handle on one stored object, or on one part of a multipart upload.
 * <p>
 * The blob identity ({@link #inode}, {@link #version}) addresses the data in
 * the chunk store of {@link #region}. {@link #size} and {@link #checksum} stay
 * unset until a write completes and commits them together; a descriptor
 * without a checksum is incomplete.
 */
public class ObjectDescriptor {

    public UUID containerId;

    public String key;

    public Integer partNumber;

    public String region;

    public UUID inode;

    public UUID version;

    public Long size;

    public String checksum;

    public static ObjectDescriptor create(UUID containerId, String key, String region) {
        ObjectDescriptor descriptor = new ObjectDescriptor();
        descriptor.containerId = containerId;
        descriptor.key = key;
        descriptor.region = region;
        descriptor.inode = UUID.randomUUID();
        descriptor.version = UUID.randomUUID();
        return descriptor;
    }

    public static ObjectDescriptor part(UUID containerId, String key, int partNumber, String region) {
        ObjectDescriptor descriptor = create(containerId, key, region);
        descriptor.partNumber = partNumber;
        return descriptor;
    }

    /**
     * Records the final size and checksum in one step.
     */
    public synchronized void commit(long size, String checksum) {
        this.size = size;
        this.checksum = checksum;
    }

    public synchronized boolean isComplete() {
        return size != null && checksum != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(key == null ? "?" : key);
        if (partNumber != null) {
            sb.append("#").append(partNumber);
        }
        return sb.append(" (").append(inode).append("/").append(version).append(")").toString();
    }
}
