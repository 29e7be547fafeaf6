package eu.virtualparadox.docsearch.index;

import java.util.NoSuchElementException;

/**
 * Raised when a tenant id has no configured knowledge folder.
 */
public class UnknownTenantException extends NoSuchElementException {

    private final String tenantId;

    public UnknownTenantException(final String tenantId) {
        super("Unknown tenant: " + tenantId);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
