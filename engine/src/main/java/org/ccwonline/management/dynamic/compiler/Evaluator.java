package org.ccwonline.management.dynamic.compiler;

/**
 * A compiled expression node.
 *
 * The frame holds lambda parameters in the first slots followed by the element
 * variables of sequence functions. A new frame is allocated for each invocation.
 */
@FunctionalInterface
public interface Evaluator {

    Object evaluate(Object[] frame);
}
