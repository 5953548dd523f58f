package com.faceblog.gateway.web;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.model.ResourceType;
import com.faceblog.gateway.model.RouteRequirement;
import com.faceblog.gateway.service.PermissionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.PathContainer;
import org.springframework.stereotype.Component;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a request to what it requires. The first configured rule that matches method and
 * path decides; otherwise the capability follows from the HTTP method and nothing is metered
 * or billed.
 */
@Component
public class RoutePolicy {
    private static final Logger log = LoggerFactory.getLogger(RoutePolicy.class);

    private final List<String> protectedPrefixes;
    private final List<CompiledRule> rules;
    private final PermissionEngine permissionEngine;

    public RoutePolicy(GwProperties properties, PermissionEngine permissionEngine) {
        this.permissionEngine = permissionEngine;
        GwProperties.RoutesConfig routes = properties.getRoutes();
        this.protectedPrefixes = List.copyOf(routes.getProtectedPrefixes());

        List<CompiledRule> compiled = new ArrayList<>();
        for (GwProperties.RouteRule rule : routes.getRules()) {
            compiled.add(CompiledRule.of(rule));
        }
        this.rules = List.copyOf(compiled);
        log.info("RoutePolicy initialized: protectedPrefixes={}, rules={}", protectedPrefixes, rules.size());
    }

    public boolean isProtected(String path) {
        for (String prefix : protectedPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public RouteRequirement requirementFor(HttpMethod method, String path) {
        PathContainer container = PathContainer.parsePath(path);
        for (CompiledRule rule : rules) {
            if (rule.matches(method, container)) {
                String capability = rule.capability() != null
                        ? rule.capability()
                        : permissionEngine.capabilityFor(method);
                return new RouteRequirement(capability, rule.resource(), rule.feature(),
                        rule.subscriptionRequired(), rule.trialLimit(), rule.optionalAuth());
            }
        }
        return new RouteRequirement(permissionEngine.capabilityFor(method), null);
    }

    private record CompiledRule(PathPattern pattern, Set<String> methods, String capability,
                                ResourceType resource, String feature, boolean subscriptionRequired,
                                Integer trialLimit, boolean optionalAuth) {

        static CompiledRule of(GwProperties.RouteRule rule) {
            Set<String> methods = rule.getMethods().stream()
                    .map(m -> m.trim().toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            String capability = rule.getCapability() != null && !rule.getCapability().isBlank()
                    ? rule.getCapability().trim()
                    : null;
            ResourceType resource = rule.getResource() != null && !rule.getResource().isBlank()
                    ? ResourceType.fromKey(rule.getResource())
                    : null;
            if (rule.getTrialLimit() != null && resource == null) {
                throw new IllegalArgumentException("Route rule " + rule.getPattern()
                        + " sets trial-limit without a resource");
            }
            String feature = rule.getFeature() != null && !rule.getFeature().isBlank()
                    ? rule.getFeature().trim()
                    : null;
            return new CompiledRule(PathPatternParser.defaultInstance.parse(rule.getPattern()),
                    methods, capability, resource, feature, rule.isSubscriptionRequired(),
                    rule.getTrialLimit(), rule.isOptionalAuth());
        }

        boolean matches(HttpMethod method, PathContainer path) {
            return (methods.isEmpty() || methods.contains(method.name())) && pattern.matches(path);
        }
    }
}
