package org.dxworks.apislice.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An HTTP route registration found in a source file.
 * Two records are the same endpoint when method, route and start line agree.
 */
public class EndpointRecord {
    public String method;
    public String route;
    public String filePath;
    public int startLine;
    public int endLine;
    public DetectionTier tier;
    /** Bare identifiers passed to the registration call, e.g. {@code handler} in {@code app.get('/', handler)}. */
    public List<String> handlerNames = new ArrayList<>();

    public EndpointRecord() {
    }

    public EndpointRecord(String method, String route, String filePath, int startLine, int endLine, DetectionTier tier) {
        this.method = method;
        this.route = route;
        this.filePath = filePath;
        this.startLine = startLine;
        this.endLine = endLine;
        this.tier = tier;
    }

    public List<Object> identityKey() {
        return Arrays.asList(method, route, startLine);
    }

    @Override
    public String toString() {
        return method + " " + route + " (" + filePath + ":" + startLine + "-" + endLine + ", " + tier + ")";
    }
}
