package works.asdl.c;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.lang.invoke.MethodHandles;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.asdl.c.ast.CAst;
import works.asdl.c.ast.CAst.Node;
import works.asdl.convert.AstConverter;
import works.asdl.convert.ConverterCache;
import works.asdl.convert.ConverterSettings;
import works.asdl.convert.NodeRegistry;
import works.asdl.exceptions.AsdlException;
import works.asdl.exceptions.AsdlSyntaxException;
import works.asdl.grammar.AsdlGrammarReader;
import works.asdl.grammar.Grammar;
import works.asdl.subword.SubwordModel;
import works.asdl.tree.AsdlTree;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Entry points for converting C abstract syntax trees ({@link CAst}) to and from {@link AsdlTree}s.
 * <p>
 * Callers that convert many trees should hold on to an {@link AstConverter}
 * from {@link #converter}. The static {@link #toAsdl} and {@link #toC} methods
 * are conveniences that keep converters, without subword models,
 * for the few most recently used grammars.
 */
public final class CAsdl {
	private CAsdl() {}

	public static final String GRAMMAR_RESOURCE = "c.asdl";

	/**
	 * @return the bundled C grammar, read on first use
	 */
	public static Grammar grammar() {
		return GrammarHolder.GRAMMAR;
	}

	public static NodeRegistry<Node> registry() {
		return REGISTRY;
	}

	/**
	 * @param subwordModel if null, identifiers and strings are encoded as single tokens
	 * @throws works.asdl.exceptions.InvalidNodeTypeException if {@code grammar} doesn't fit {@link CAst}
	 */
	public static AstConverter<Node> converter(Grammar grammar, @Nullable SubwordModel subwordModel) {
		return new AstConverter<>(grammar, REGISTRY, CTerminals.TABLES, ConverterSettings.DEFAULT, subwordModel);
	}

	public static AsdlTree toAsdl(Node node, Grammar grammar) {
		return CACHE.get(grammar).encode(node);
	}

	public static Node toC(AsdlTree tree, Grammar grammar) {
		return CACHE.get(grammar).decode(tree);
	}

	static Grammar readBundledGrammar() {
		try (InputStream in = CAsdl.class.getResourceAsStream(GRAMMAR_RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("Missing resource " + GRAMMAR_RESOURCE);
			}
			Grammar result = new AsdlGrammarReader().read(new InputStreamReader(in, UTF_8));
			LOGGER.debug("Loaded bundled C grammar: {}", result);
			return result;
		} catch (AsdlSyntaxException e) {
			throw AsdlException.wrap(e, GRAMMAR_RESOURCE);
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read " + GRAMMAR_RESOURCE, e);
		}
	}

	private static final class GrammarHolder {
		static final Grammar GRAMMAR = readBundledGrammar();
	}

	private static final NodeRegistry<Node> REGISTRY = NodeRegistry.scan(Node.class, MethodHandles.lookup());
	private static final ConverterCache<Node> CACHE = new ConverterCache<>(grammar -> converter(grammar, null));
	private static final Logger LOGGER = LoggerFactory.getLogger(CAsdl.class);
}
