package org.ccwonline.management.query;

/**
 * Sort direction of an ordering key.
 */
public enum Sort {
    ASC,
    DESC
}
