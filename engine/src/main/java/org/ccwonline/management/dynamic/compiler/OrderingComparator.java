package org.ccwonline.management.dynamic.compiler;

import org.ccwonline.management.dynamic.DynamicOrdering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-key comparator over parsed orderings, primary key first.
 *
 * Nulls sort first in ascending order and last in descending order.
 *
 * @param <T> The element type
 */
public final class OrderingComparator<T> implements Comparator<T> {

    private final List<Evaluator> keys = new ArrayList<>();
    private final List<Boolean> ascending = new ArrayList<>();
    private final int frameSize;

    /**
     * @param orderings The orderings, whose selectors read the element from frame slot 0
     * @param frameSize The frame size the selectors need
     */
    public OrderingComparator(List<DynamicOrdering> orderings, int frameSize) {
        if (orderings.isEmpty()) {
            throw new IllegalArgumentException("At least one ordering is required");
        }
        ExpressionCompiler compiler = new ExpressionCompiler();
        for (DynamicOrdering ordering : orderings) {
            keys.add(compiler.compile(ordering.selector()));
            ascending.add(ordering.ascending());
        }
        this.frameSize = Math.max(1, frameSize);
    }

    @Override
    public int compare(T left, T right) {
        Object[] leftFrame = new Object[frameSize];
        Object[] rightFrame = new Object[frameSize];
        leftFrame[0] = left;
        rightFrame[0] = right;
        for (int i = 0; i < keys.size(); i++) {
            Evaluator key = keys.get(i);
            int c = Operators.compare(key.evaluate(leftFrame), key.evaluate(rightFrame));
            if (c != 0) {
                return ascending.get(i) ? c : -c;
            }
        }
        return 0;
    }
}
