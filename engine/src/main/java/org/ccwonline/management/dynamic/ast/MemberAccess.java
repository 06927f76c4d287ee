package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.Member;
import org.ccwonline.management.dynamic.types.TypeRef;

import java.util.Objects;

/**
 * Property or field read.
 *
 * @param instance The target, null for static members such as {@code DateTime.Now}
 * @param member   The resolved member
 */
public record MemberAccess(Expression instance, Member member) implements Expression {

    public MemberAccess {
        Objects.requireNonNull(member, "Member cannot be null");
        if (instance == null && !member.isStatic()) {
            throw new IllegalArgumentException("Instance member '" + member.name() + "' needs a target");
        }
    }

    @Override
    public TypeRef type() {
        return member.type();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
