package works.asdl.tree;

/**
 * A value held by a {@link RealizedField}: either a nested {@link AsdlTree}
 * or, for fields of a primitive type, a raw {@link Token}.
 */
public sealed interface AsdlValue permits AsdlTree, Token {
}
