package io.jobrelay.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record StagedJob(
        String id,
        ObjectNode params,
        long stagedAtMs
) {
    public static final String ID_PREFIX = "staged_";

    public static boolean isStagedId(String id) {
        return id != null && id.startsWith(ID_PREFIX);
    }

    public String runName() {
        return params.path("run_name").asText(null);
    }

    public String description() {
        return params.path("description").asText(null);
    }
}
