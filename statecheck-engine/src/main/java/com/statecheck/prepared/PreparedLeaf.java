package com.statecheck.prepared;

import com.statecheck.model.Result;
import com.statecheck.model.Severity;

/**
 * An entry produced by {@code walkComparisons()}: a runnable comparison or a recorded preparation failure.
 */
public interface PreparedLeaf {

    /**
     * @return the latest result, or {@code null} if a comparison has not run yet
     */
    Result getResult();

    /**
     * The leaf's result, or an internal error when there is none yet.
     *
     * @param leaf walked entry
     * @return a non-null result
     */
    static Result resultOf(PreparedLeaf leaf) {
        Result result = leaf.getResult();
        if (result == null) {
            return Result.of(Severity.INTERNAL_ERROR, "No result available (comparison not run?)");
        }
        return result;
    }
}
