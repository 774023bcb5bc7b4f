package com.geoenrich.query;

import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.exception.EnrichmentException;
import com.geoenrich.exception.NetworkException;
import com.geoenrich.exception.PaginationSafetyException;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.RawFeature;
import com.geoenrich.model.SourcePage;
import com.geoenrich.model.SourceQuery;
import com.geoenrich.model.SpatialRelation;
import com.geoenrich.source.SpatialSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains every page of a source query. The offset always advances by the source's page
 * size, and a run never requests an offset beyond {@code maxOffset}, so it terminates even
 * against a service that claims more data forever.
 */
@Slf4j
@Component
public class SpatialQueryPaginator {

    private final int maxOffset;
    private final long pageDelayMs;

    @Autowired
    public SpatialQueryPaginator(EnrichmentProperties properties) {
        this(properties.getPagination().getMaxOffset(), properties.getPagination().getPageDelayMs());
    }

    public SpatialQueryPaginator(int maxOffset, long pageDelayMs) {
        this.maxOffset = maxOffset;
        this.pageDelayMs = pageDelayMs;
    }

    /**
     * Intersects query around {@code origin}; a null buffer asks for containing features only
     */
    public PagedFeatures paginate(SpatialSource source, LatLon origin, Double bufferMiles) {
        return paginate(source, SourceQuery.builder()
                .origin(origin)
                .relation(SpatialRelation.INTERSECTS)
                .bufferMiles(bufferMiles)
                .build());
    }

    /**
     * Query all pages for {@code template}; its offset and page size are overwritten per page
     */
    public PagedFeatures paginate(SpatialSource source, SourceQuery template) {
        int pageSize = Math.max(1, source.getPageSize());
        List<RawFeature> collected = new ArrayList<>();
        int offset = 0;
        int requests = 0;

        while (true) {
            if (offset > maxOffset) {
                PaginationSafetyException bound = new PaginationSafetyException(source.getId(), offset, maxOffset);
                log.warn("{}; keeping {} feature(s)", bound.getMessage(), collected.size());
                return result(collected, requests, PagedFeatures.StopReason.SAFETY_BOUND, bound);
            }
            if (requests > 0 && !pause()) {
                NetworkException interrupted = new NetworkException("Interrupted while paging source '" + source.getId() + "'");
                return result(collected, requests, PagedFeatures.StopReason.FAILED, interrupted);
            }

            SourcePage page;
            try {
                requests++;
                page = source.query(template.toBuilder().offset(offset).pageSize(pageSize).build());
            } catch (EnrichmentException e) {
                if (collected.isEmpty()) {
                    log.debug("Source '{}' failed at offset {}: {}", source.getId(), offset, e.getMessage());
                } else {
                    log.warn("Source '{}' failed at offset {}, keeping {} feature(s): {}",
                            source.getId(), offset, collected.size(), e.getMessage());
                }
                return result(collected, requests, PagedFeatures.StopReason.FAILED, e);
            }

            int received = page.received();
            if (received == 0) {
                break;
            }
            collected.addAll(page.getFeatures());
            if (!page.isHasMore() && received < pageSize) {
                break;
            }
            offset += pageSize;
        }

        log.debug("Source '{}' drained: {} feature(s) in {} request(s)", source.getId(), collected.size(), requests);
        return result(collected, requests, PagedFeatures.StopReason.COMPLETE, null);
    }

    public int getMaxOffset() {
        return maxOffset;
    }

    private boolean pause() {
        if (pageDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(pageDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static PagedFeatures result(List<RawFeature> features, int requests,
                                        PagedFeatures.StopReason reason, EnrichmentException failure) {
        return PagedFeatures.builder()
                .features(features)
                .pageRequests(requests)
                .stopReason(reason)
                .failure(failure)
                .build();
    }
}
