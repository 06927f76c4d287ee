package org.ccwonline.management.dynamic.types;

import org.ccwonline.management.dynamic.ast.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the most specific overload for a list of arguments.
 *
 * A candidate applies if every argument promotes to its parameter type. Among the
 * applicable candidates, one is kept if it is at least as good as every other for each
 * argument and strictly better for at least one. Callers report zero results as
 * incompatible operands and several as ambiguous.
 */
public final class OverloadResolver {

    private OverloadResolver() {
    }

    /**
     * An applicable overload with its arguments promoted to the parameter types.
     */
    public record Resolution<O extends Overload>(O overload, List<Expression> arguments) {
        public Resolution {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * @return The best applicable candidates; exactly one on success
     */
    public static <O extends Overload> List<Resolution<O>> findBest(List<O> candidates, List<Expression> args) {
        List<Resolution<O>> applicable = new ArrayList<>();
        for (O candidate : candidates) {
            List<Expression> promoted = promoteArguments(candidate.parameterTypes(), args);
            if (promoted != null) {
                applicable.add(new Resolution<>(candidate, promoted));
            }
        }
        if (applicable.size() <= 1) {
            return applicable;
        }
        List<Resolution<O>> best = new ArrayList<>();
        for (Resolution<O> m : applicable) {
            boolean betterThanAll = true;
            for (Resolution<O> other : applicable) {
                if (m != other && !isBetterThan(args, m.overload(), other.overload())) {
                    betterThanAll = false;
                    break;
                }
            }
            if (betterThanAll) {
                best.add(m);
            }
        }
        return best.isEmpty() ? applicable : best;
    }

    private static List<Expression> promoteArguments(List<TypeRef> parameters, List<Expression> args) {
        if (parameters.size() != args.size()) {
            return null;
        }
        List<Expression> promoted = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            Expression p = Promotions.promote(args.get(i), parameters.get(i), false);
            if (p == null) {
                return null;
            }
            promoted.add(p);
        }
        return promoted;
    }

    private static boolean isBetterThan(List<Expression> args, Overload m1, Overload m2) {
        boolean better = false;
        for (int i = 0; i < args.size(); i++) {
            int c = Types.compareConversions(args.get(i).type(),
                    m1.parameterTypes().get(i), m2.parameterTypes().get(i));
            if (c < 0) {
                return false;
            }
            if (c > 0) {
                better = true;
            }
        }
        return better;
    }
}
