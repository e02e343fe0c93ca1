package io.mediarealm.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of every non-2xx response.
 *   { "kind": "VALIDATION", "error": "invalid input: path-too-short", "violations": ["path-too-short"] }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    public String kind;
    public String error;
    public List<String> violations;

    public static ErrorResponse of(String kind, String error) {
        ErrorResponse r = new ErrorResponse();
        r.kind = kind;
        r.error = error;
        return r;
    }
}
