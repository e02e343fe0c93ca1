package io.mediarealm.server.dto;

/**
 * JSON body for POST /realms/{id}/children.
 * Example:
 *   { "name": "Lectures", "pathSegment": "lectures" }
 */
public class AddChildRequest {
    public String name;
    public String pathSegment;
}
