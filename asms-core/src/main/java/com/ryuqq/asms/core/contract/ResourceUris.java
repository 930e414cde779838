package com.ryuqq.asms.core.contract;

/**
 * Resource URI helpers.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceUris {

    public static final String SCHEME = "asms://";

    // Utility class - prevent instantiation
    private ResourceUris() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String of(String domain, String path) {
        return SCHEME + domain + "/" + path;
    }

    public static boolean hasPrefix(String uri, String prefix) {
        return uri != null && uri.startsWith(prefix);
    }

    /**
     * 접두사를 제거한 나머지 경로.
     *
     * @return 접두사가 없으면 null
     */
    public static String stripPrefix(String uri, String prefix) {
        return hasPrefix(uri, prefix) ? uri.substring(prefix.length()) : null;
    }
}
