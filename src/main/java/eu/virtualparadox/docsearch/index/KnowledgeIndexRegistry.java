package eu.virtualparadox.docsearch.index;

import eu.virtualparadox.docsearch.application.config.ApplicationConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the current {@link KnowledgeIndex} of every configured tenant.
 * <p>
 * All indexes are built at startup; a tenant whose folder cannot be read prevents the
 * application from starting. Afterwards readers get the current index without locking,
 * while {@link #rebuild(String)} swaps in a freshly built one. Rebuilds are serialized;
 * a failed rebuild leaves the previous index in place.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeIndexRegistry {

    private final ApplicationConfig config;
    private final KnowledgeIndexBuilder builder;

    private final Map<String, KnowledgeIndex> indexes = new ConcurrentHashMap<>();

    /**
     * Builds the index of every configured tenant.
     *
     * @throws IllegalStateException if any tenant folder cannot be indexed
     */
    @PostConstruct
    public void loadAll() {
        final Map<String, Path> tenants = config.getTenants();
        if (tenants.isEmpty()) {
            log.warn("No tenants configured under docsearch.tenants; every lookup will fail");
            return;
        }

        for (final Map.Entry<String, Path> tenant : tenants.entrySet()) {
            try {
                indexes.put(tenant.getKey(), builder.buildIndex(tenant.getKey(), tenant.getValue()));
            } catch (final IOException e) {
                throw new IllegalStateException("Failed to build knowledge index for tenant " + tenant.getKey()
                        + " from " + tenant.getValue(), e);
            }
        }
        log.info("Knowledge indexes ready for tenants {}", indexes.keySet());
    }

    public Optional<KnowledgeIndex> find(final String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(indexes.get(tenantId));
    }

    /**
     * @throws UnknownTenantException if the tenant has no index
     */
    public KnowledgeIndex require(final String tenantId) {
        return find(tenantId).orElseThrow(() -> new UnknownTenantException(tenantId));
    }

    /**
     * Rebuilds a tenant's index from its configured folder and publishes it.
     *
     * @param tenantId configured tenant
     * @return the new index
     * @throws UnknownTenantException if the tenant is not configured
     * @throws IOException            if the folder cannot be read; the previous index stays active
     */
    public synchronized KnowledgeIndex rebuild(final String tenantId) throws IOException {
        final Path folder = folderOf(tenantId);
        try {
            final KnowledgeIndex rebuilt = builder.buildIndex(tenantId, folder);
            indexes.put(tenantId, rebuilt);
            log.info("Rebuilt index for tenant {} ({} chunks)", tenantId, rebuilt.size());
            return rebuilt;
        } catch (final IOException e) {
            log.error("Rebuild failed for tenant {}, keeping previous index", tenantId, e);
            throw e;
        }
    }

    public List<TenantSummary> tenants() {
        return indexes.values().stream()
                .sorted(Comparator.comparing(KnowledgeIndex::tenantId))
                .map(index -> TenantSummary.of(index, folderOf(index.tenantId())))
                .toList();
    }

    public TenantSummary summary(final String tenantId) {
        return TenantSummary.of(require(tenantId), folderOf(tenantId));
    }

    private Path folderOf(final String tenantId) {
        final Path folder = tenantId == null ? null : config.getTenants().get(tenantId);
        if (folder == null) {
            throw new UnknownTenantException(tenantId);
        }
        return folder;
    }
}
