package pygen.trans.passes.codegen.python;

import pygen.model.typed.*;
import pygen.util.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the source names a module binds at the top level of the generated Python module, with
 * the location of their first definition.
 */
public class TopLevelNamesVisitor extends TypedDefinitionVisitor<Void, RuntimeException> {

	private final Map<String, SourceSpan> names = new LinkedHashMap<>();

	public Map<String, SourceSpan> getNames() {
		return Collections.unmodifiableMap(names);
	}

	private void add(String name, SourceSpan location) {
		names.putIfAbsent(name, location);
	}

	@Override
	public Void visit(TypedImport typedImport) throws RuntimeException {
		TypedImportAlias alias = typedImport.getAlias();
		if (alias != null && alias.isDiscard()) {
			return null;
		}
		if (!typedImport.getUnqualifiedImports().isEmpty()) {
			for (TypedUnqualifiedImport unqualified : typedImport.getUnqualifiedImports()) {
				if (!unqualified.isType()) {
					String local = unqualified.getAlias() == null ? unqualified.getName() : unqualified.getAlias();
					add(local, unqualified.getLocation());
				}
			}
			return null;
		}
		if (alias != null) {
			add(alias.getName(), typedImport.getLocation());
			return null;
		}
		String module = typedImport.getModule();
		add(module.substring(module.lastIndexOf('/') + 1), typedImport.getLocation());
		return null;
	}

	@Override
	public Void visit(TypedCustomType customType) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TypedTypeAlias typeAlias) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TypedModuleConstant moduleConstant) throws RuntimeException {
		add(moduleConstant.getName(), moduleConstant.getLocation());
		return null;
	}

	@Override
	public Void visit(TypedFunction function) throws RuntimeException {
		if (function.getName() != null &&
				(function.getExternalPython() != null || function.supports(Target.PYTHON))) {
			add(function.getName(), function.getLocation());
		}
		return null;
	}
}
