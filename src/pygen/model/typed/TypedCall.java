package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedCall extends TypedExpression {

	private final TypedExpression fun;
	private final List<TypedExpression> arguments;

	public TypedCall(SourceSpan location, TypedExpression fun, List<TypedExpression> arguments) {
		super(location);
		this.fun = fun;
		this.arguments = arguments;
	}

	public TypedExpression getFun() {
		return fun;
	}

	public List<TypedExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedCall that = (TypedCall) o;
		return Objects.equals(fun, that.fun) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fun, arguments);
	}
}
