package com.faceblog.gateway.model;

/**
 * Advisory notice that a resource is close to its plan limit.
 */
public record UsageWarning(ResourceType resource, long current, long limit, int percentage) {

    public String headerValue() {
        return resource.key() + " usage at " + percentage + "%";
    }
}
