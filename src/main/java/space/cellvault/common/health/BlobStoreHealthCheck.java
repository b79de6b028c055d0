package space.cellvault.common.health;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.*;
import space.cellvault.blob.BlobStore;
import space.cellvault.blob.BlobStoreRegistry;
import space.cellvault.blob.PostgresBlobStore;

import java.util.Map;
import java.util.Optional;

/**
 * Health checks for the blob streaming service.
 */
@ApplicationScoped
public class BlobStoreHealthCheck {

    @Inject
    BlobStoreRegistry registry;

    /**
     * Liveness check - is the application alive?
     */
    @Liveness
    public HealthCheck liveness() {
        return () -> HealthCheckResponse.up("cellvault-alive");
    }

    /**
     * Readiness check - is a chunk store configured for every region, and is
     * the database reachable when a region is served by PostgreSQL?
     */
    @Readiness
    public AsyncHealthCheck readiness() {
        return () -> {
            HealthCheckResponseBuilder builder = HealthCheckResponse.named("cellvault-ready");

            Map<String, BlobStore> regions = registry.regions();
            if (regions.isEmpty()) {
                return Uni.createFrom().item(builder.down()
                        .withData("regions", 0)
                        .build());
            }

            builder.withData("regions", regions.size())
                    .withData("default_region", registry.getDefaultRegion());
            regions.forEach((region, store) -> builder.withData("region." + region, store.getClass().getSimpleName()));

            Optional<PostgresBlobStore> database = regions.values().stream()
                    .filter(PostgresBlobStore.class::isInstance)
                    .map(PostgresBlobStore.class::cast)
                    .findFirst();
            if (database.isEmpty()) {
                return Uni.createFrom().item(builder.up().build());
            }

            return database.get().countBlocks()
                    .onItem().transform(blocks -> builder.up()
                            .withData("database", "connected")
                            .withData("stored_blocks", blocks)
                            .build())
                    .onFailure().recoverWithItem(e -> builder.down()
                            .withData("database", "disconnected")
                            .withData("error", e.getMessage())
                            .build());
        };
    }
}
