package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

/**
 * A reference to a name. module is the defining module for module-level values and record
 * constructors, and null for local variables.
 */
public class TypedVar extends TypedExpression {

	private final String name;
	private final ValueConstructorKind kind;
	private final String module;

	public TypedVar(SourceSpan location, String name, ValueConstructorKind kind, String module) {
		super(location);
		this.name = name;
		this.kind = kind;
		this.module = module;
	}

	public String getName() {
		return name;
	}

	public ValueConstructorKind getKind() {
		return kind;
	}

	public String getModule() {
		return module;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedVar that = (TypedVar) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(kind, that.kind) &&
				Objects.equals(module, that.module);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kind, module);
	}
}
