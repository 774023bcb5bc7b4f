package com.geoenrich.client;

import com.geoenrich.config.EnrichmentProperties;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * One way of reaching a URL: directly, or through a proxy that takes the target
 * either appended verbatim (prefix) or URL-encoded (wrap)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FetchStrategy {

    public enum Kind {
        DIRECT, PREFIX, WRAP
    }

    private static final FetchStrategy DIRECT = new FetchStrategy(Kind.DIRECT, "");

    private final Kind kind;
    private final String base;

    private FetchStrategy(Kind kind, String base) {
        this.kind = kind;
        this.base = base;
    }

    public static FetchStrategy direct() {
        return DIRECT;
    }

    public static FetchStrategy prefix(String base) {
        return new FetchStrategy(Kind.PREFIX, base);
    }

    public static FetchStrategy wrap(String base) {
        return new FetchStrategy(Kind.WRAP, base);
    }

    public static FetchStrategy fromProxy(EnrichmentProperties.Proxy proxy) {
        if (proxy.getBase() == null || proxy.getBase().isBlank()) {
            throw new IllegalArgumentException("Proxy base must not be empty");
        }
        if ("wrap".equalsIgnoreCase(proxy.getType())) {
            return wrap(proxy.getBase());
        }
        if ("prefix".equalsIgnoreCase(proxy.getType())) {
            return prefix(proxy.getBase());
        }
        throw new IllegalArgumentException("Unknown proxy type: " + proxy.getType());
    }

    public String apply(String url) {
        switch (kind) {
            case PREFIX:
                return base + url;
            case WRAP:
                return base + URLEncoder.encode(url, StandardCharsets.UTF_8);
            default:
                return url;
        }
    }
}
