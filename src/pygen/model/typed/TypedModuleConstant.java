package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedModuleConstant extends TypedDefinition {

	private final Publicity publicity;
	private final String name;
	private final TypedExpression value;

	public TypedModuleConstant(SourceSpan location, Publicity publicity, String name, TypedExpression value) {
		super(location);
		this.publicity = publicity;
		this.name = name;
		this.value = value;
	}

	public Publicity getPublicity() {
		return publicity;
	}

	public String getName() {
		return name;
	}

	public TypedExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedModuleConstant that = (TypedModuleConstant) o;
		return Objects.equals(publicity, that.publicity) &&
				Objects.equals(name, that.name) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(publicity, name, value);
	}
}
