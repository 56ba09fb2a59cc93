package org.pragmatica.latex.error;

/**
 * Reason of a failed operation. Carried by {@link org.pragmatica.latex.util.Result.Failure}.
 */
public interface Cause {
    /**
     * Human-readable description of the failure.
     */
    String message();
}
