package org.ccwonline.management.dynamic.types;

import java.util.List;

/**
 * A candidate for overload resolution: an operator signature, a built-in method or an
 * aggregate function.
 */
public interface Overload {

    List<TypeRef> parameterTypes();
}
