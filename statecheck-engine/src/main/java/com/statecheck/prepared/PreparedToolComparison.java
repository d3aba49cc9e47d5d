package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.model.Result;
import com.statecheck.tool.ResultKeyNotFoundException;
import com.statecheck.tool.Tool;
import com.statecheck.tool.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * A comparison against one key of a tool's result.
 */
public class PreparedToolComparison extends PreparedComparison {
    private final Tool tool;

    PreparedToolComparison(
            DataCache cache,
            String key,
            Comparison comparison,
            String name,
            PreparedConfiguration parent,
            Tool tool
    ) {
        super(cache, key, comparison, name, parent);
        this.tool = tool;
    }

    /**
     * Binds a comparison to a tool result key.
     *
     * @throws PreparedComparisonException if the tool does not produce the key
     */
    public static PreparedToolComparison fromTool(
            Tool tool,
            String resultKey,
            Comparison comparison,
            String name,
            PreparedConfiguration parent,
            DataCache cache
    ) throws PreparedComparisonException {
        try {
            tool.checkResultKey(resultKey);
        } catch (RuntimeException e) {
            throw new PreparedComparisonException(e.getMessage(), e, resultKey, comparison, name);
        }
        return new PreparedToolComparison(cache, resultKey, comparison, name, parent, tool);
    }

    @Override
    public CompletableFuture<ToolResult> getDataAsync() {
        return getCache().getToolData(tool);
    }

    @Override
    protected Result compareData(Object data) {
        Object value;
        try {
            value = ((ToolResult) data).lookup(getIdentifier());
        } catch (ResultKeyNotFoundException e) {
            return Result.of(getComparison().getSeverityOnFailure(),
                    "Provided key is invalid for tool result (" + tool.getClass().getSimpleName()
                            + " " + getIdentifier() + "): " + e.getMessage());
        }
        return getComparison().compare(value, getIdentifier());
    }

    public Tool getTool() {
        return tool;
    }
}
