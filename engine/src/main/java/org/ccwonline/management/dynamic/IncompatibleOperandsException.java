package org.ccwonline.management.dynamic;

import org.ccwonline.management.dynamic.types.TypeRef;

/**
 * No operator signature accepts the operand types.
 */
public class IncompatibleOperandsException extends ParseException {

    public IncompatibleOperandsException(String operator, TypeRef left, TypeRef right, int position) {
        super("Operator '" + operator + "' incompatible with operand types '"
                + left.typeName() + "' and '" + right.typeName() + "'", position);
    }

    public IncompatibleOperandsException(String operator, TypeRef operand, int position) {
        super("Operator '" + operator + "' incompatible with operand type '" + operand.typeName() + "'", position);
    }
}
