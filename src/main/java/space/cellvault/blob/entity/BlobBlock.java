package space.cellvault.blob.entity;

import io.quarkus.hibernate.reactive.panache.PanacheEntityBase;
import io.smallrye.mutiny.Uni;
import jakarta.persistence.*;
import java.util.List;
import java.util.UUID;

/**
 * Entity marking an opened block of a blob.
 */
@Entity
@Table(name = "blob_blocks", uniqueConstraints = {
        @UniqueConstraint(columnNames = { "inode", "version", "block_id" })
})
public class BlobBlock extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    public UUID id;

    @Column(name = "inode", nullable = false)
    public UUID inode;

    @Column(name = "version", nullable = false)
    public UUID versionId;

    @Column(name = "block_id", nullable = false)
    public long blockId;

    @Column(name = "start_offset", nullable = false)
    public long startOffset;

    // Panache Finder Methods
    public static Uni<List<BlobBlock>> findOrderedByBlob(UUID inode, UUID version) {
        return list("inode = ?1 AND versionId = ?2 ORDER BY blockId ASC", inode, version);
    }

    public static Uni<Boolean> exists(UUID inode, UUID version, long blockId) {
        return count("inode = ?1 AND versionId = ?2 AND blockId = ?3", inode, version, blockId)
                .map(count -> count > 0);
    }
}
