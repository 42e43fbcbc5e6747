package com.shlokmestry.gateway.csp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CspDirectives(Map<String, List<String>> directives, boolean upgradeInsecureRequests) {

    public CspDirectives {
        // header order
        Map<String, List<String>> copy = new LinkedHashMap<>();
        directives.forEach((name, sources) -> copy.put(name, List.copyOf(sources)));
        directives = Collections.unmodifiableMap(copy);
    }

    public List<String> sources(String directive) {
        return directives.getOrDefault(directive, List.of());
    }
}
