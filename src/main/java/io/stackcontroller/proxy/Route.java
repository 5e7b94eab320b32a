package io.stackcontroller.proxy;

/**
 * Path prefix served by one upstream node.
 *
 * @param pathPrefix   e.g. {@code /api}; {@code /} matches everything
 * @param upstreamNode service node whose health gates the route
 * @param upstreamUrl  base URL requests are forwarded to, e.g. {@code http://entities:8000}
 */
public record Route(String pathPrefix, String upstreamNode, String upstreamUrl) {

    public Route {
        if (pathPrefix == null || !pathPrefix.startsWith("/")) {
            throw new IllegalArgumentException("Route prefix must start with '/': " + pathPrefix);
        }
        if (pathPrefix.length() > 1 && pathPrefix.endsWith("/")) {
            pathPrefix = pathPrefix.substring(0, pathPrefix.length() - 1);
        }
        if (upstreamNode == null || upstreamNode.isBlank()) {
            throw new IllegalArgumentException("Route " + pathPrefix + " needs an upstream node");
        }
        if (upstreamUrl == null || upstreamUrl.isBlank()) {
            throw new IllegalArgumentException("Route " + pathPrefix + " needs an upstream url");
        }
        if (upstreamUrl.endsWith("/")) {
            upstreamUrl = upstreamUrl.substring(0, upstreamUrl.length() - 1);
        }
    }

    /**
     * Prefix match on whole path segments: {@code /api} matches {@code /api} and
     * {@code /api/cars} but not {@code /apis}.
     */
    public boolean matches(String path) {
        if ("/".equals(pathPrefix)) {
            return true;
        }
        return path.equals(pathPrefix) || path.startsWith(pathPrefix + "/");
    }
}
