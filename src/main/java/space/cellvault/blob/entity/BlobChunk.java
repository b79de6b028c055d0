package space.cellvault.blob.entity;

import io.quarkus.hibernate.reactive.panache.PanacheEntityBase;
import io.smallrye.mutiny.Uni;
import jakarta.persistence.*;
import java.util.List;
import java.util.UUID;

/**
 * Entity representing one stored chunk.
 * The offset is the object offset of the chunk's first byte.
 */
@Entity
@Table(name = "blob_chunks", uniqueConstraints = {
        @UniqueConstraint(columnNames = { "inode", "version", "block_id", "chunk_offset" })
})
public class BlobChunk extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "inode", nullable = false)
    public UUID inode;

    @Column(name = "version", nullable = false)
    public UUID versionId;

    @Column(name = "block_id", nullable = false)
    public long blockId;

    @Column(name = "chunk_offset", nullable = false)
    public long chunkOffset;

    @Column(name = "size", nullable = false)
    public int size;

    @Column(name = "data", nullable = false, columnDefinition = "BYTEA")
    public byte[] data;

    public static Uni<List<BlobChunk>> findPage(UUID inode, UUID version, long blockId, long fromOffset,
            int pageSize) {
        return find("inode = ?1 AND versionId = ?2 AND blockId = ?3 AND chunkOffset >= ?4 ORDER BY chunkOffset ASC",
                inode, version, blockId, fromOffset)
                .page(0, pageSize)
                .list();
    }
}
