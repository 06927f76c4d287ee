package org.ccwonline.management.repository;

/**
 * Thrown by {@code findOne} when more than one entity matches.
 */
public class NonUniqueResultException extends RepositoryException {

    public NonUniqueResultException(String entityName) {
        super("More than one " + entityName + " matches");
    }
}
