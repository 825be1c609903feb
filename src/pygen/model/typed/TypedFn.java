package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

public class TypedFn extends TypedExpression {

	private final List<TypedArg> arguments;
	private final List<TypedStatement> body;

	public TypedFn(SourceSpan location, List<TypedArg> arguments, List<TypedStatement> body) {
		super(location);
		this.arguments = arguments;
		this.body = body;
	}

	public List<TypedArg> getArguments() {
		return arguments;
	}

	public List<TypedStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedFn that = (TypedFn) o;
		return Objects.equals(arguments, that.arguments) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments, body);
	}
}
