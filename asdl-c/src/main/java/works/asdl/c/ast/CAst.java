package works.asdl.c.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * C abstract syntax, mirroring the node classes of pycparser's {@code c_ast}.
 * <p>
 * Each record corresponds to the grammar constructor with the same name,
 * and its components correspond, in order, to the constructor's fields.
 * Identifiers, literal text and lexical tokens like operators are plain strings.
 * Optional components are null when absent;
 * list components are never null in trees built by the converter,
 * though a null list is accepted, and encoded, as empty.
 */
public final class CAst {
	private CAst() {}

	public sealed interface Node { }

	//
	// Types and declarations
	//

	public record ArrayDecl(Node type, @Nullable Node dim, List<String> dimQuals) implements Node { }
	public record Decl(@Nullable String name, List<String> quals, List<String> storage, List<String> funcspec, Node type, @Nullable Node init, @Nullable Node bitsize) implements Node { }
	public record DeclList(List<Node> decls) implements Node { }
	public record EllipsisParam() implements Node { }
	public record Enum(@Nullable String name, @Nullable Node values) implements Node { }
	public record Enumerator(String name, @Nullable Node value) implements Node { }
	public record EnumeratorList(List<Node> enumerators) implements Node { }
	public record FileAST(List<Node> ext) implements Node { }
	public record FuncDecl(@Nullable Node args, Node type) implements Node { }
	public record FuncDef(Node decl, List<Node> paramDecls, Node body) implements Node { }
	public record IdentifierType(List<String> names) implements Node { }
	public record ParamList(List<Node> params) implements Node { }
	public record PtrDecl(List<String> quals, Node type) implements Node { }
	public record Struct(@Nullable String name, List<Node> decls) implements Node { }
	public record TypeDecl(@Nullable String declname, List<String> quals, Node type) implements Node { }
	public record Typedef(String name, List<String> quals, List<String> storage, Node type) implements Node { }
	public record Typename(@Nullable String name, List<String> quals, Node type) implements Node { }
	public record Union(@Nullable String name, List<Node> decls) implements Node { }

	//
	// Statements
	//

	public record Break() implements Node { }
	public record Case(Node expr, List<Node> stmts) implements Node { }
	public record Compound(List<Node> blockItems) implements Node { }
	public record Continue() implements Node { }
	public record Default(List<Node> stmts) implements Node { }
	public record DoWhile(Node cond, @Nullable Node stmt) implements Node { }
	public record EmptyStatement() implements Node { }
	public record For(@Nullable Node init, @Nullable Node cond, @Nullable Node next, Node stmt) implements Node { }
	public record Goto(String name) implements Node { }
	public record If(Node cond, @Nullable Node iftrue, @Nullable Node iffalse) implements Node { }
	public record Label(String name, Node stmt) implements Node { }
	public record Pragma(String string) implements Node { }
	public record Return(@Nullable Node expr) implements Node { }
	public record StaticAssert(Node cond, @Nullable Node message) implements Node { }
	public record Switch(Node cond, Node stmt) implements Node { }
	public record While(Node cond, @Nullable Node stmt) implements Node { }

	//
	// Expressions
	//

	public record ArrayRef(Node name, Node subscript) implements Node { }
	public record Assignment(String op, Node lvalue, Node rvalue) implements Node { }
	public record BinaryOp(String op, Node left, Node right) implements Node { }
	public record Cast(Node toType, Node expr) implements Node { }
	public record CompoundLiteral(Node type, Node init) implements Node { }

	/**
	 * @param type the literal kind, like {@code "int"} or {@code "string"}
	 * @param value the literal as written, quotes included
	 */
	public record Constant(String type, String value) implements Node { }

	public record ExprList(List<Node> exprs) implements Node { }
	public record FuncCall(Node name, @Nullable Node args) implements Node { }
	public record ID(String name) implements Node { }
	public record InitList(List<Node> exprs) implements Node { }
	public record NamedInitializer(List<Node> name, Node expr) implements Node { }

	/**
	 * @param type {@code "->"} or {@code "."}
	 */
	public record StructRef(Node name, String type, Node field) implements Node { }

	public record TernaryOp(Node cond, Node iftrue, Node iffalse) implements Node { }

	/**
	 * @param op the operator; pre-increment and pre-decrement are spelled {@code "p++"} and {@code "p--"}
	 */
	public record UnaryOp(String op, Node expr) implements Node { }
}
