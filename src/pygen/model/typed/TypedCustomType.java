package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedCustomType extends TypedDefinition {

	private final Publicity publicity;
	private final String name;

	public TypedCustomType(SourceSpan location, Publicity publicity, String name) {
		super(location);
		this.publicity = publicity;
		this.name = name;
	}

	public Publicity getPublicity() {
		return publicity;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedCustomType that = (TypedCustomType) o;
		return Objects.equals(publicity, that.publicity) &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(publicity, name);
	}
}
