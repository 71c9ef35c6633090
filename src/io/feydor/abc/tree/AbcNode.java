package io.feydor.abc.tree;

/**
 * Anything that can sit in the syntax tree: a raw token or a parsed construct.
 * The id is the only stable handle on a node once lists start being mutated.
 */
public sealed interface AbcNode permits Token, Expr {
    int id();

    <R> R accept(Visitor<R> visitor);
}
