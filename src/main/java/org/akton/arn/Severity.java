package org.akton.arn;

/**
 * Classifies errors by where the fault lies.
 */
public enum Severity {
    /**
     * The caller supplied a value that does not satisfy the ARN grammar.
     * Expected for untrusted input; the same input will always be rejected.
     */
    INPUT,

    /**
     * The library could not complete the operation for reasons unrelated to the input.
     * Example: the entropy source backing identifier generation is unavailable.
     */
    SYSTEM
}
