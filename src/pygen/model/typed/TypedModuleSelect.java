package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.Objects;

public class TypedModuleSelect extends TypedExpression {

	private final String moduleName;
	private final String moduleAlias;
	private final String label;
	private final ValueConstructorKind kind;

	public TypedModuleSelect(SourceSpan location, String moduleName, String moduleAlias, String label, ValueConstructorKind kind) {
		super(location);
		this.moduleName = moduleName;
		this.moduleAlias = moduleAlias;
		this.label = label;
		this.kind = kind;
	}

	public String getModuleName() {
		return moduleName;
	}

	public String getModuleAlias() {
		return moduleAlias;
	}

	public String getLabel() {
		return label;
	}

	public ValueConstructorKind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedModuleSelect that = (TypedModuleSelect) o;
		return Objects.equals(moduleName, that.moduleName) &&
				Objects.equals(moduleAlias, that.moduleAlias) &&
				Objects.equals(label, that.label) &&
				Objects.equals(kind, that.kind);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleName, moduleAlias, label, kind);
	}
}
