package io.mediarealm.server.dto;

/** JSON body for PATCH /realms/{id}/path-segment. */
public class PathSegmentRequest {
    public String pathSegment;
}
