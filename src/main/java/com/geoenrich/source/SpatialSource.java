package com.geoenrich.source;

import com.geoenrich.model.FieldAliases;
import com.geoenrich.model.SourcePage;
import com.geoenrich.model.SourceQuery;

import java.util.List;

/**
 * A paged, queryable feature service
 */
public interface SpatialSource {

    String getId();

    /**
     * Page size the service documents; the paginator advances by this much
     */
    int getPageSize();

    List<String> getIdentityFields();

    FieldAliases getFieldAliases();

    /**
     * Fetch one page. Implementations surface transport and service errors as
     * {@link com.geoenrich.exception.EnrichmentException} subclasses.
     */
    SourcePage query(SourceQuery query);
}
