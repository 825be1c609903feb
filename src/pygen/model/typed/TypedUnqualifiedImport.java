package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedUnqualifiedImport extends TypedNode {

	private final String name;
	private final String alias;
	private final boolean type;

	public TypedUnqualifiedImport(SourceSpan location, String name, String alias, boolean type) {
		super(location);
		this.name = name;
		this.alias = alias;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public String getAlias() {
		return alias;
	}

	public boolean isType() {
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedUnqualifiedImport that = (TypedUnqualifiedImport) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(alias, that.alias) &&
				type == that.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, alias, type);
	}
}
