package pygen.trans.passes.codegen.python;

import pygen.InternalCompilerError;
import pygen.model.typed.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Registers the Python imports needed by one definition: explicit import declarations, and the
 * foreign symbols that implement external functions.
 */
public class ImportCollectionVisitor extends TypedDefinitionVisitor<Void, RuntimeException> {

	private final Imports imports;

	public ImportCollectionVisitor(Imports imports) {
		this.imports = imports;
	}

	@Override
	public Void visit(TypedImport typedImport) throws RuntimeException {
		List<String> segments = pathSegments(typedImport.getModule());
		TypedImportAlias alias = typedImport.getAlias();
		List<TypedUnqualifiedImport> unqualifiedImports = typedImport.getUnqualifiedImports();

		if (alias != null && !unqualifiedImports.isEmpty()) {
			throw new InternalCompilerError(
					"import of " + typedImport.getModule() + " has both an alias and unqualified members");
		}
		if (alias != null && alias.isDiscard()) {
			return null;
		}

		if (!unqualifiedImports.isEmpty()) {
			List<ImportMember> members = new ArrayList<>();
			for (TypedUnqualifiedImport unqualified : unqualifiedImports) {
				if (unqualified.isType()) {
					continue;
				}
				String memberAlias = unqualified.getAlias() == null ?
						null : Identifiers.maybeEscape(unqualified.getAlias());
				members.add(new ImportMember(Identifiers.maybeEscape(unqualified.getName()), memberAlias));
			}
			if (!members.isEmpty()) {
				imports.registerMembers(String.join(".", segments), members);
			}
			return null;
		}

		String aliasName = alias == null ? null : Identifiers.maybeEscape(alias.getName());
		if (segments.size() == 1) {
			if (aliasName == null) {
				imports.registerModule(segments.get(0));
			} else {
				imports.registerMember(Imports.BARE_PATH, new ImportMember(segments.get(0), aliasName));
			}
			return null;
		}
		String parent = String.join(".", segments.subList(0, segments.size() - 1));
		imports.registerMember(parent, new ImportMember(segments.get(segments.size() - 1), aliasName));
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
		return null;
	}

	@Override
	public Void visit(TypedFunction function) throws RuntimeException {
		TypedExternal external = function.getExternalPython();
		if (external == null) {
			return null;
		}
		String name = function.getName();
		if (name == null) {
			throw new InternalCompilerError("external function without a name");
		}
		String symbol = external.getFunction();
		String local = Identifiers.maybeEscape(name);
		String alias = local.equals(symbol) ? null : local;
		String path = String.join(".", pathSegments(external.getModule()));
		imports.registerMember(path, new ImportMember(symbol, alias));
		return null;
	}

	// foreign module names may be written with either separator
	private static List<String> pathSegments(String module) {
		if (module == null || module.isEmpty()) {
			throw new InternalCompilerError("import with an empty module path");
		}
		List<String> segments = Arrays.asList(module.split("[/.]", -1));
		for (String segment : segments) {
			if (segment.isEmpty()) {
				throw new InternalCompilerError("import of " + module + " has an empty path segment");
			}
		}
		return segments;
	}
}
