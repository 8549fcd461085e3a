package com.threatsentinel.core.monitor;

/**
 * Thrown when stopping a target that is not being monitored.
 */
public class MonitorNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String url;

    public MonitorNotFoundException(String url) {
        super("Website not monitored: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
