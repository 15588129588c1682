package com.thevig.backend.catalog;

import java.util.List;

/**
 * Read access to the draftable options of a pool.
 */
public interface ResourceCatalog {

    List<CatalogResource> listResources(String poolId);

    boolean contains(String poolId, String resourceId);
}
