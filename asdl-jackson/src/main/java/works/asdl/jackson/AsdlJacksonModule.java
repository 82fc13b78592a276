package works.asdl.jackson;

import tools.jackson.core.Version;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.module.SimpleDeserializers;
import tools.jackson.databind.module.SimpleSerializers;
import works.asdl.grammar.Grammar;
import works.asdl.tree.AsdlTree;

import static java.util.Objects.requireNonNull;

/**
 * Registers the {@link AsdlTree} codec of {@link JacksonTreeSerializer} for one {@link Grammar}.
 */
public final class AsdlJacksonModule extends JacksonModule {
	private final Grammar grammar;

	AsdlJacksonModule(Grammar grammar) {
		this.grammar = requireNonNull(grammar);
	}

	public Grammar grammar() {
		return grammar;
	}

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		SimpleSerializers serializers = new SimpleSerializers();
		serializers.addSerializer(AsdlTree.class, new JacksonTreeSerializer.TreeSerializer(grammar));
		context.addSerializers(serializers);
		SimpleDeserializers deserializers = new SimpleDeserializers();
		deserializers.addDeserializer(AsdlTree.class, new JacksonTreeSerializer.TreeDeserializer(grammar));
		context.addDeserializers(deserializers);
	}
}
