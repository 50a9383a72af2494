package org.tricoteuses.amendment.extract;

/**
 * Turns an old fragment and its replacement into a displayable diff. Implemented outside this library.
 */
@FunctionalInterface
public interface DiffRenderer {

    String render(String oldText, String newText);
}
