package pygen.model.typed;

import pygen.util.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * An import declaration. The module is a slash separated path; the alias is null when absent.
 */
public class TypedImport extends TypedDefinition {

	private final String module;
	private final TypedImportAlias alias;
	private final List<TypedUnqualifiedImport> unqualifiedImports;

	public TypedImport(SourceSpan location, String module, TypedImportAlias alias, List<TypedUnqualifiedImport> unqualifiedImports) {
		super(location);
		this.module = module;
		this.alias = alias;
		this.unqualifiedImports = unqualifiedImports;
	}

	public String getModule() {
		return module;
	}

	public TypedImportAlias getAlias() {
		return alias;
	}

	public List<TypedUnqualifiedImport> getUnqualifiedImports() {
		return unqualifiedImports;
	}

	@Override
	public <T, E extends Throwable> T accept(TypedDefinitionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedImport that = (TypedImport) o;
		return Objects.equals(module, that.module) &&
				Objects.equals(alias, that.alias) &&
				Objects.equals(unqualifiedImports, that.unqualifiedImports);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, alias, unqualifiedImports);
	}
}
