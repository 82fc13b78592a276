package works.asdl.c;

import works.asdl.convert.TerminalTable;
import works.asdl.convert.TerminalTables;

/**
 * Terminal tables mapping C's lexical tokens to the terminal constructors of {@code c.asdl}.
 * <p>
 * Every table is one-to-one except {@link #LITERAL_TYPE}, where the several spellings
 * of integer and floating-point types share a constructor and decode to
 * {@code "int"} and {@code "double"} respectively.
 */
public final class CTerminals {
	private CTerminals() {}

	public static final TerminalTable QUAL = TerminalTable.builder("QUAL")
		.map("const", "Const")
		.map("volatile", "Volatile")
		.map("restrict", "Restrict")
		.build();

	public static final TerminalTable DIM_QUAL = TerminalTable.builder("DIM_QUAL")
		.map("const", "ConstDim")
		.map("volatile", "VolatileDim")
		.map("restrict", "RestrictDim")
		.map("static", "StaticDim")
		.build();

	public static final TerminalTable STORAGE = TerminalTable.builder("STORAGE")
		.map("extern", "Extern")
		.map("static", "Static")
		.map("register", "Register")
		.map("auto", "Auto")
		.map("typedef", "TypedefStorage")
		.build();

	public static final TerminalTable FUNCSPEC = TerminalTable.builder("FUNCSPEC")
		.map("inline", "Inline")
		.build();

	public static final TerminalTable REF_TYPE = TerminalTable.builder("REF_TYPE")
		.map("->", "Arrow")
		.map(".", "Dot")
		.build();

	public static final TerminalTable ASSIGN_OPER = TerminalTable.builder("ASSIGN_OPER")
		.map("=", "NormalAssign")
		.map("+=", "AddAssign")
		.map("-=", "SubAssign")
		.map("*=", "MulAssign")
		.map("/=", "DivAssign")
		.map("%=", "ModAssign")
		.map("&=", "BitAndAssign")
		.map("|=", "BitOrAssign")
		.map("^=", "BitXorAssign")
		.map("<<=", "LShiftAssign")
		.map(">>=", "RShiftAssign")
		.build();

	/**
	 * pycparser spells prefix increment and decrement {@code p++} and {@code p--};
	 * plain {@code ++} and {@code --} are postfix.
	 */
	public static final TerminalTable UNARY_OP = TerminalTable.builder("UNARY_OP")
		.map("+", "UAdd")
		.map("-", "USub")
		.map("p++", "PreInc")
		.map("++", "PostInc")
		.map("p--", "PreDec")
		.map("--", "PostDec")
		.map("!", "Not")
		.map("~", "BitNot")
		.map("*", "Deref")
		.map("sizeof", "SizeOf")
		.map("&", "AddressOf")
		.build();

	public static final TerminalTable BINARY_OP = TerminalTable.builder("BINARY_OP")
		.map("=", "Assign")
		.map("+", "Add")
		.map("-", "Sub")
		.map("*", "Mul")
		.map("/", "Div")
		.map("%", "Mod")
		.map("==", "Eq")
		.map("!=", "NotEq")
		.map("<", "Lt")
		.map("<=", "LtE")
		.map(">", "Gt")
		.map(">=", "GtE")
		.map("&&", "And")
		.map("||", "Or")
		.map("&", "BitAnd")
		.map("|", "BitOr")
		.map("^", "BitXor")
		.map("<<", "LShift")
		.map(">>", "RShift")
		.build();

	public static final TerminalTable LITERAL_TYPE = TerminalTable.builder("LITERAL_TYPE")
		.map("int", "IntLiteral")
		.map("long int", "IntLiteral")
		.map("long long int", "IntLiteral")
		.map("unsigned int", "IntLiteral")
		.map("unsigned long int", "IntLiteral")
		.map("unsigned long long int", "IntLiteral")
		.map("float", "FloatLiteral")
		.map("double", "FloatLiteral")
		.map("long double", "FloatLiteral")
		.map("char", "CharLiteral")
		.map("string", "StringLiteral")
		.canonical("IntLiteral", "int")
		.canonical("FloatLiteral", "double")
		.build();

	public static final TerminalTables TABLES = TerminalTables.builder()
		.table(QUAL)
		.table(DIM_QUAL)
		.table(STORAGE)
		.table(FUNCSPEC)
		.table(REF_TYPE)
		.table(ASSIGN_OPER)
		.table(UNARY_OP)
		.table(BINARY_OP)
		.table(LITERAL_TYPE)
		.build();
}
