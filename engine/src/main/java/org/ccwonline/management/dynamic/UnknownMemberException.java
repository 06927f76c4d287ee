package org.ccwonline.management.dynamic;

/**
 * A property, field or method was not found on the resolved type.
 */
public class UnknownMemberException extends ParseException {

    private final String memberName;

    public UnknownMemberException(String message, String memberName, int position) {
        super(message, position);
        this.memberName = memberName;
    }

    public String getMemberName() {
        return memberName;
    }
}
