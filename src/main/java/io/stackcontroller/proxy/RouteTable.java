package io.stackcontroller.proxy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Path-based routing: the longest matching prefix wins.
 */
public class RouteTable {

    private final List<Route> routes;

    public RouteTable(List<Route> routes) {
        Set<String> prefixes = new HashSet<>();
        for (Route route : routes) {
            if (!prefixes.add(route.pathPrefix())) {
                throw new IllegalArgumentException("Duplicate route prefix: " + route.pathPrefix());
            }
        }
        List<Route> sorted = new ArrayList<>(routes);
        sorted.sort(Comparator.comparingInt((Route route) -> route.pathPrefix().length()).reversed());
        this.routes = List.copyOf(sorted);
    }

    public Optional<Route> match(String path) {
        String normalized = path == null || path.isEmpty() ? "/" : path;
        for (Route route : routes) {
            if (route.matches(normalized)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    public List<Route> getRoutes() {
        return routes;
    }
}
