package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedTypeAlias extends TypedDefinition {

	private final Publicity publicity;
	private final String alias;

	public TypedTypeAlias(SourceSpan location, Publicity publicity, String alias) {
		super(location);
		this.publicity = publicity;
		this.alias = alias;
	}

	public Publicity getPublicity() {
		return publicity;
	}

	public String getAlias() {
		return alias;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedTypeAlias that = (TypedTypeAlias) o;
		return Objects.equals(publicity, that.publicity) &&
				Objects.equals(alias, that.alias);
	}

	@Override
	public int hashCode() {
		return Objects.hash(publicity, alias);
	}
}
