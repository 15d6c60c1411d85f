package io.gearledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Outcome of one API call. Transport failures have status 0 and a
 * {@link MissingNode} body.
 */
public record ApiResult(boolean ok, int status, JsonNode body, String error) {
    public static ApiResult success(int status, JsonNode body) {
        return new ApiResult(true, status, body, null);
    }

    public static ApiResult failure(int status, JsonNode body, String error) {
        return new ApiResult(false, status, body == null ? MissingNode.getInstance() : body, error);
    }

    public static ApiResult transportFailure(String error) {
        return failure(0, null, error);
    }
}
