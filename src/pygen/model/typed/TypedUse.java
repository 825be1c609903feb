package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedUse extends TypedStatement {

	private final List<String> names;
	private final TypedExpression call;

	public TypedUse(SourceSpan location, List<String> names, TypedExpression call) {
		super(location);
		this.names = names;
		this.call = call;
	}

	public List<String> getNames() {
		return names;
	}

	public TypedExpression getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedUse that = (TypedUse) o;
		return Objects.equals(names, that.names) &&
				Objects.equals(call, that.call);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, call);
	}
}
