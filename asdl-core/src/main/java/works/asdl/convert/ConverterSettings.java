package works.asdl.convert;

import java.util.Map;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConverterSettings {
	/**
	 * Field types whose native values are strings encoded as leaf trees,
	 * either one token or a sequence of subword pieces.
	 */
	@Default Map<String, LeafConstructors> leafTypes = Map.of(
		"IDENT", new LeafConstructors("IdentToken", "IdentSubword"),
		"STR", new LeafConstructors("StrToken", "StrSubword")
	);

	/**
	 * When true, every constructor named by a {@link TerminalTable} must exist in the grammar
	 * as a zero-field production of the table's type, or the converter can't be built.
	 * When false, such mismatches surface only when the offending token is converted.
	 */
	@Default boolean strictTerminalTables = true;

	public static final ConverterSettings DEFAULT = ConverterSettings.builder().build();
}
