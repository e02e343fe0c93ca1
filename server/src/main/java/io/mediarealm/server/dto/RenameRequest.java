package io.mediarealm.server.dto;

/** JSON body for PATCH /realms/{id}/name. */
public class RenameRequest {
    public String name;
}
