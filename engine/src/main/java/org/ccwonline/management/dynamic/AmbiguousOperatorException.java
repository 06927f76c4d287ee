package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.types.TypeRef;

/**
 * Several operator signatures apply and none is more specific than the others.
 */
public class AmbiguousOperatorException extends ParseException {

    public AmbiguousOperatorException(String operator, TypeRef left, TypeRef right, int position) {
        super("Ambiguous operator '" + operator + "' for operand types '"
                + left.typeName() + "' and '" + right.typeName() + "'", position);
    }

    public AmbiguousOperatorException(String operator, TypeRef operand, int position) {
        super("Ambiguous operator '" + operator + "' for operand type '" + operand.typeName() + "'", position);
    }
}
