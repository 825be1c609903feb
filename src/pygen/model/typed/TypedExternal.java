package pygen.model.typed;

import java.util.Objects;

/**
 * A foreign implementation of a function: a symbol in a Python module. The module may be dotted.
 */
public class TypedExternal {

	private final String module;
	private final String function;

	public TypedExternal(String module, String function) {
		this.module = module;
		this.function = function;
	}

	public String getModule() {
		return module;
	}

	public String getFunction() {
		return function;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedExternal that = (TypedExternal) o;
		return Objects.equals(module, that.module) &&
				Objects.equals(function, that.function);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, function);
	}
}
