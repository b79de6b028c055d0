package space.cellvault.blob;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.literal.NamedLiteral;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.cellvault.common.exception.NotFoundException;
import space.cellvault.common.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the chunk store holding the data of a region.
 * <p>
 * Regions are configured as {@code region=backend} pairs, where the backend
 * is the {@code @Named} value of a {@link BlobStore} bean.
 */
@ApplicationScoped
public class BlobStoreRegistry {

    private static final Logger LOG = Logger.getLogger(BlobStoreRegistry.class);

    @ConfigProperty(name = "blobstore.regions", defaultValue = "default=memory")
    List<String> regionMappings;

    @ConfigProperty(name = "blobstore.default-region", defaultValue = "default")
    String defaultRegion;

    @Inject
    @Any
    Instance<BlobStore> stores;

    private final Map<String, BlobStore> regions = new LinkedHashMap<>();

    BlobStoreRegistry() {
    }

    private BlobStoreRegistry(String defaultRegion, Map<String, BlobStore> regions) {
        this.defaultRegion = defaultRegion;
        this.regions.putAll(regions);
    }

    public static BlobStoreRegistry of(String defaultRegion, Map<String, BlobStore> regions) {
        return new BlobStoreRegistry(defaultRegion, regions);
    }

    @PostConstruct
    void init() {
        for (String mapping : regionMappings) {
            String[] parts = mapping.split("=", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new ValidationException("Invalid region mapping: " + mapping);
            }
            String region = parts[0].trim();
            String backend = parts[1].trim();

            Instance<BlobStore> store = stores.select(NamedLiteral.of(backend));
            if (!store.isResolvable()) {
                throw new NotFoundException("could not find blob store backend: " + backend);
            }
            regions.put(region, store.get());
            LOG.infof("Region %s served by %s blob store", region, backend);
        }
    }

    /**
     * Get the store of a region; {@code null} selects the default region.
     */
    public BlobStore forRegion(String region) {
        String name = region != null ? region : defaultRegion;
        BlobStore store = regions.get(name);
        if (store == null) {
            throw new NotFoundException("could not find region: " + name);
        }
        return store;
    }

    public BlobStore forDescriptor(ObjectDescriptor descriptor) {
        return forRegion(descriptor.region);
    }

    public Map<String, BlobStore> regions() {
        return Collections.unmodifiableMap(regions);
    }

    public String getDefaultRegion() {
        return defaultRegion;
    }
}
