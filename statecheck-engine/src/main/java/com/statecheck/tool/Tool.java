package com.statecheck.tool;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A check that is not tied to a signal, such as host reachability.
 *
 * <p>Tools are compared by value: two equal tool specifications share one run in the data cache.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Ping.class, name = "Ping")
})
public abstract class Tool {

    /**
     * Top-level keys of the result this tool produces.
     *
     * @return result keys
     */
    public abstract Set<String> resultKeys();

    /**
     * Runs the tool.
     *
     * @param executor executor for blocking work
     * @return result bundle
     */
    public abstract CompletableFuture<ToolResult> run(Executor executor);

    /**
     * Verifies that a (possibly dotted) key addresses this tool's result.
     *
     * @param key result key
     * @throws InvalidResultKeyException if the top-level key is unknown
     */
    public void checkResultKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidResultKeyException("Result key is blank for tool " + getClass().getSimpleName());
        }
        String topLevel = key.split("\\.", 2)[0];
        if (!resultKeys().contains(topLevel)) {
            throw new InvalidResultKeyException("Key '" + key + "' is not valid for " + getClass().getSimpleName()
                    + " results; expected one of " + resultKeys());
        }
    }
}
