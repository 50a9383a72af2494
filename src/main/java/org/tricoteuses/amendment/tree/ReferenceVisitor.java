package org.tricoteuses.amendment.tree;

/**
 * Exhaustive visitor over {@link ReferenceNode} variants. Adding a variant breaks every
 * implementation at compile time.
 */
public interface ReferenceVisitor<R> {

    R visitText(ReferenceNode.Text text);

    R visitArticle(ReferenceNode.Article article);

    R visitDivision(ReferenceNode.Division division);

    R visitPortion(ReferenceNode.Portion portion);

    R visitWords(ReferenceNode.Words words);

    R visitParentChild(ReferenceNode.ParentChild parentChild);

    R visitEnumeration(ReferenceNode.Enumeration enumeration);

    R visitBoundedInterval(ReferenceNode.BoundedInterval interval);

    R visitCountedInterval(ReferenceNode.CountedInterval interval);
}
