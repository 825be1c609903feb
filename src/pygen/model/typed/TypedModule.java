package pygen.model.typed;

import java.util.List;
import java.util.Objects;

/**
 * A type-checked module: its slash separated name and its definitions in source order.
 */
public class TypedModule {

	private final String name;
	private final List<TypedDefinition> definitions;

	public TypedModule(String name, List<TypedDefinition> definitions) {
		this.name = name;
		this.definitions = definitions;
	}

	public String getName() {
		return name;
	}

	public List<TypedDefinition> getDefinitions() {
		return definitions;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedModule that = (TypedModule) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(definitions, that.definitions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, definitions);
	}
}
