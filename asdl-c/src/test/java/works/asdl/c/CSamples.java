package works.asdl.c;

import java.util.List;
import works.asdl.c.ast.CAst.ArrayDecl;
import works.asdl.c.ast.CAst.ArrayRef;
import works.asdl.c.ast.CAst.Assignment;
import works.asdl.c.ast.CAst.BinaryOp;
import works.asdl.c.ast.CAst.Break;
import works.asdl.c.ast.CAst.Case;
import works.asdl.c.ast.CAst.Cast;
import works.asdl.c.ast.CAst.Compound;
import works.asdl.c.ast.CAst.CompoundLiteral;
import works.asdl.c.ast.CAst.Constant;
import works.asdl.c.ast.CAst.Continue;
import works.asdl.c.ast.CAst.Decl;
import works.asdl.c.ast.CAst.DeclList;
import works.asdl.c.ast.CAst.Default;
import works.asdl.c.ast.CAst.DoWhile;
import works.asdl.c.ast.CAst.EllipsisParam;
import works.asdl.c.ast.CAst.EmptyStatement;
import works.asdl.c.ast.CAst.Enum;
import works.asdl.c.ast.CAst.Enumerator;
import works.asdl.c.ast.CAst.EnumeratorList;
import works.asdl.c.ast.CAst.ExprList;
import works.asdl.c.ast.CAst.FileAST;
import works.asdl.c.ast.CAst.For;
import works.asdl.c.ast.CAst.FuncCall;
import works.asdl.c.ast.CAst.FuncDecl;
import works.asdl.c.ast.CAst.FuncDef;
import works.asdl.c.ast.CAst.Goto;
import works.asdl.c.ast.CAst.ID;
import works.asdl.c.ast.CAst.IdentifierType;
import works.asdl.c.ast.CAst.If;
import works.asdl.c.ast.CAst.InitList;
import works.asdl.c.ast.CAst.Label;
import works.asdl.c.ast.CAst.NamedInitializer;
import works.asdl.c.ast.CAst.Node;
import works.asdl.c.ast.CAst.ParamList;
import works.asdl.c.ast.CAst.Pragma;
import works.asdl.c.ast.CAst.PtrDecl;
import works.asdl.c.ast.CAst.Return;
import works.asdl.c.ast.CAst.StaticAssert;
import works.asdl.c.ast.CAst.Struct;
import works.asdl.c.ast.CAst.StructRef;
import works.asdl.c.ast.CAst.Switch;
import works.asdl.c.ast.CAst.TernaryOp;
import works.asdl.c.ast.CAst.TypeDecl;
import works.asdl.c.ast.CAst.Typedef;
import works.asdl.c.ast.CAst.Typename;
import works.asdl.c.ast.CAst.UnaryOp;
import works.asdl.c.ast.CAst.Union;
import works.asdl.c.ast.CAst.While;

/**
 * C trees shaped the way pycparser produces them, built by hand.
 */
final class CSamples {
	private CSamples() {}

	static IdentifierType type(String... names) {
		return new IdentifierType(List.of(names));
	}

	static TypeDecl typeDecl(String name, Node type) {
		return new TypeDecl(name, List.of(), type);
	}

	static Decl decl(String name, Node type, Node init) {
		return new Decl(name, List.of(), List.of(), List.of(), type, init, null);
	}

	static Decl intVar(String name, Node init) {
		return decl(name, typeDecl(name, type("int")), init);
	}

	static Constant intConst(String value) {
		return new Constant("int", value);
	}

	static ID id(String name) {
		return new ID(name);
	}

	static FuncDef function(String returnType, String name, ParamList params, Node... body) {
		FuncDecl funcDecl = new FuncDecl(params, typeDecl(name, type(returnType)));
		return new FuncDef(decl(name, funcDecl, null), List.of(), new Compound(List.of(body)));
	}

	static ParamList voidParams() {
		return new ParamList(List.of(new Typename(null, List.of(), typeDecl(null, type("void")))));
	}

	/**
	 * <pre>
	 * int main(void) { int x = 0; x += 1; return x; }
	 * </pre>
	 */
	static FileAST simpleMain() {
		return new FileAST(List.of(function("int", "main", voidParams(),
			intVar("x", intConst("0")),
			new Assignment("+=", id("x"), intConst("1")),
			new Return(id("x"))
		)));
	}

	/**
	 * <pre>
	 * static const char *greeting = "hello, world";
	 * extern volatile unsigned long counter;
	 * inline int twice(int n) { return n * 2; }
	 * </pre>
	 */
	static FileAST qualifiers() {
		Decl greeting = new Decl("greeting", List.of("const"), List.of("static"), List.of(),
			new PtrDecl(List.of(), new TypeDecl("greeting", List.of("const"), type("char"))),
			new Constant("string", "\"hello, world\""),
			null);
		Decl counter = new Decl("counter", List.of("volatile"), List.of("extern"), List.of(),
			new TypeDecl("counter", List.of("volatile"), type("unsigned", "long")),
			null,
			null);
		ParamList params = new ParamList(List.of(decl("n", typeDecl("n", type("int")), null)));
		FuncDef twice = new FuncDef(
			new Decl("twice", List.of(), List.of(), List.of("inline"),
				new FuncDecl(params, typeDecl("twice", type("int"))), null, null),
			List.of(),
			new Compound(List.of(new Return(new BinaryOp("*", id("n"), intConst("2"))))));
		return new FileAST(List.of(greeting, counter, twice));
	}

	/**
	 * <pre>
	 * struct point { int x, y; unsigned flags : 3; };
	 * typedef struct point point_t;
	 * union value { int i; double d; };
	 * enum color { RED, GREEN = 2 };
	 * </pre>
	 */
	static FileAST aggregates() {
		Struct point = new Struct("point", List.of(
			intVar("x", null),
			intVar("y", null),
			new Decl("flags", List.of(), List.of(), List.of(), typeDecl("flags", type("unsigned")), null, intConst("3"))
		));
		Decl pointDecl = new Decl(null, List.of(), List.of(), List.of(), point, null, null);
		Typedef pointT = new Typedef("point_t", List.of(), List.of("typedef"),
			typeDecl("point_t", new Struct("point", List.of())));
		Union value = new Union("value", List.of(
			intVar("i", null),
			decl("d", typeDecl("d", type("double")), null)
		));
		Enum color = new Enum("color", new EnumeratorList(List.of(
			new Enumerator("RED", null),
			new Enumerator("GREEN", intConst("2"))
		)));
		return new FileAST(List.of(
			pointDecl,
			pointT,
			new Decl(null, List.of(), List.of(), List.of(), value, null, null),
			new Decl(null, List.of(), List.of(), List.of(), color, null, null)
		));
	}

	/**
	 * <pre>
	 * void loop(int n, ...) {
	 *     for (int i = 0; i &lt; n; ++i) { if (i % 2) continue; else break; }
	 *     while (n--) ;
	 *     do { n = n &gt;&gt; 1; } while (n &amp;&amp; !done);
	 *     switch (n) { case 1: n = -n; break; default: ; }
	 *     again: goto again;
	 * }
	 * </pre>
	 */
	static FileAST controlFlow() {
		ParamList params = new ParamList(List.of(
			decl("n", typeDecl("n", type("int")), null),
			new EllipsisParam()));
		For forLoop = new For(
			new DeclList(List.of(intVar("i", intConst("0")))),
			new BinaryOp("<", id("i"), id("n")),
			new UnaryOp("p++", id("i")),
			new Compound(List.of(new If(new BinaryOp("%", id("i"), intConst("2")), new Continue(), new Break()))));
		While whileLoop = new While(new UnaryOp("--", id("n")), new EmptyStatement());
		DoWhile doWhile = new DoWhile(
			new BinaryOp("&&", id("n"), new UnaryOp("!", id("done"))),
			new Compound(List.of(new Assignment("=", id("n"), new BinaryOp(">>", id("n"), intConst("1"))))));
		Switch switchStmt = new Switch(id("n"), new Compound(List.of(
			new Case(intConst("1"), List.of(new Assignment("=", id("n"), new UnaryOp("-", id("n"))), new Break())),
			new Default(List.of(new EmptyStatement())))));
		Label label = new Label("again", new Goto("again"));
		return new FileAST(List.of(function("void", "loop", params, forLoop, whileLoop, doWhile, switchStmt, label)));
	}

	/**
	 * <pre>
	 * #pragma once
	 * int table[static 4] = { [0] = 1, 2 };
	 * void f(struct point *p) {
	 *     p->x = (long) sizeof(p->y);
	 *     table[p->x] = p ? (*p).y : (struct point){ 0 }.x;
	 *     printf("%d\n", table[0], 1.5, 'c');
	 *     _Static_assert(1, "ok");
	 * }
	 * </pre>
	 */
	static FileAST expressions() {
		Decl table = new Decl("table", List.of(), List.of(), List.of(),
			new ArrayDecl(typeDecl("table", type("int")), intConst("4"), List.of("static")),
			new InitList(List.of(
				new NamedInitializer(List.of(intConst("0")), intConst("1")),
				intConst("2"))),
			null);
		ParamList params = new ParamList(List.of(
			decl("p", new PtrDecl(List.of(), typeDecl("p", new Struct("point", List.of()))), null)));
		StructRef px = new StructRef(id("p"), "->", id("x"));
		Node assignSize = new Assignment("=", px, new Cast(
			new Typename(null, List.of(), typeDecl(null, type("long"))),
			new UnaryOp("sizeof", new StructRef(id("p"), "->", id("y")))));
		Node conditional = new Assignment("=", new ArrayRef(id("table"), px), new TernaryOp(
			id("p"),
			new StructRef(new UnaryOp("*", id("p")), ".", id("y")),
			new StructRef(new CompoundLiteral(
				new Typename(null, List.of(), typeDecl(null, new Struct("point", List.of()))),
				new InitList(List.of(intConst("0")))), ".", id("x"))));
		Node call = new FuncCall(id("printf"), new ExprList(List.of(
			new Constant("string", "\"%d\\n\""),
			new ArrayRef(id("table"), intConst("0")),
			new Constant("double", "1.5"),
			new Constant("char", "'c'"))));
		Node staticAssert = new StaticAssert(intConst("1"), new Constant("string", "\"ok\""));
		return new FileAST(List.of(
			new Pragma("once"),
			table,
			function("void", "f", params, assignSize, conditional, call, staticAssert)));
	}

	static List<FileAST> all() {
		return List.of(simpleMain(), qualifiers(), aggregates(), controlFlow(), expressions());
	}
}
