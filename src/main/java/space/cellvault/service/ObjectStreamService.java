package space.cellvault.service;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.cellvault.blob.ObjectDescriptor;
import space.cellvault.common.exception.ValidationException;
import space.cellvault.stream.BlobStreams;
import space.cellvault.stream.ProgressNotifier;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Service exposing the blob streaming operations to the request layer.
 * <p>
 * The streaming engine blocks on backend and client I/O, so every operation
 * is subscribed on the worker pool and never runs on an event-loop thread.
 */
@ApplicationScoped
public class ObjectStreamService {

    private static final Logger LOG = Logger.getLogger(ObjectStreamService.class);

    @Inject
    BlobStreams streams;

    // ==================== Object Operations ====================

    public Uni<ObjectDescriptor> putObject(InputStream source, ObjectDescriptor descriptor) {
        LOG.debugf("Storing object: %s", descriptor);

        return blocking(() -> streams.ingest(source, descriptor))
                .invoke(d -> LOG.infof("Stored object: %s (size=%d, checksum=%s)", d, d.size, d.checksum));
    }

    public Uni<ObjectDescriptor> getObject(ObjectDescriptor descriptor, OutputStream sink) {
        return blocking(() -> {
            if (!descriptor.isComplete()) {
                throw new ValidationException("Object is not completely written: " + descriptor);
            }
            return streams.drain(descriptor, sink);
        });
    }

    public Uni<ObjectDescriptor> copyObject(ObjectDescriptor source, ObjectDescriptor destination) {
        return blocking(() -> streams.duplicate(source, destination))
                .invoke(d -> LOG.infof("Copied object: %s to %s (size=%d)", source, d, d.size));
    }

    /**
     * Assemble the parts of a multipart upload into {@code destination}.
     * Parts are ordered by part number; every part must be complete and
     * carry a distinct part number.
     */
    public Uni<ObjectDescriptor> completeMultipartUpload(List<ObjectDescriptor> parts, ObjectDescriptor destination,
            ProgressNotifier notifier) {
        return blocking(() -> streams.consolidate(orderParts(parts), destination, notifier))
                .invoke(d -> LOG.infof("Completed multipart upload: %s (parts=%d, size=%d, checksum=%s)",
                        d, parts.size(), d.size, d.checksum));
    }

    /**
     * Verify object integrity by comparing stored checksum with computed checksum.
     */
    public Uni<Boolean> verifyIntegrity(ObjectDescriptor descriptor) {
        return blocking(() -> streams.verify(descriptor));
    }

    static List<ObjectDescriptor> orderParts(List<ObjectDescriptor> parts) {
        Set<Integer> seen = new HashSet<>();
        for (ObjectDescriptor part : parts) {
            if (part.partNumber == null) {
                throw new ValidationException("Missing part number: " + part);
            }
            if (!seen.add(part.partNumber)) {
                throw new ValidationException("Duplicate part number: " + part.partNumber);
            }
            if (!part.isComplete()) {
                throw new ValidationException("Part is not completely written: " + part);
            }
        }

        List<ObjectDescriptor> ordered = new ArrayList<>(parts);
        ordered.sort(Comparator.comparing(p -> p.partNumber));
        return ordered;
    }

    private static <T> Uni<T> blocking(Supplier<T> work) {
        return Uni.createFrom().item(work)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }
}
