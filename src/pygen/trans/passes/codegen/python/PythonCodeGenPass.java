package pygen.trans.passes.codegen.python;

import pygen.PyGenOptions;
import pygen.errors.Issue;
import pygen.model.doc.Document;
import pygen.model.typed.TypedDefinition;
import pygen.model.typed.TypedModule;
import pygen.scope.ScopeTable;
import pygen.util.LineNumbers;
import pygen.util.SourceSpan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static pygen.model.doc.DocBuilder.*;

/**
 * Generates the Python source of one type-checked module.
 *
 * The output is the module's imports, followed by its functions and then its constants, each
 * separated by a blank line. Any issue is reported wrapped in the context of the source file;
 * internal compiler errors are not wrapped.
 */
public class PythonCodeGenPass {

	private static final Logger logger = Logger.getLogger("PyGen CodeGen");

	private PythonCodeGenPass() {}

	public static String perform(TypedModule module, LineNumbers lineNumbers, Path path, String src,
	                             PyGenOptions options) {
		logger.info("Generating Python for module " + module.getName());
		try {
			return generate(module, options).toPrettyString(options.lineWidth);
		} catch (Issue issue) {
			throw issue.withContext(new GeneratingModule(path, src, lineNumbers));
		}
	}

	public static Document generate(TypedModule module, PyGenOptions options) {
		Imports imports = new Imports();
		ImportCollectionVisitor importCollector = new ImportCollectionVisitor(imports);
		TopLevelNamesVisitor topLevelNames = new TopLevelNamesVisitor();
		for (TypedDefinition definition : module.getDefinitions()) {
			definition.accept(importCollector);
			definition.accept(topLevelNames);
		}

		ScopeTable moduleScope = new ScopeTable();
		Map<String, SourceSpan> names = topLevelNames.getNames();
		for (Map.Entry<String, SourceSpan> entry : names.entrySet()) {
			String name = entry.getKey();
			if (!Identifiers.isUsable(name) && names.containsKey(Identifiers.escape(name))) {
				throw new IdentifierCollisionIssue(name, Identifiers.escape(name), entry.getValue());
			}
			moduleScope.reference(name);
		}

		DefinitionCodeGenVisitor definitions = new DefinitionCodeGenVisitor(
				module.getName(), moduleScope, options.targetSupport, options.indent);
		for (TypedDefinition definition : module.getDefinitions()) {
			definition.accept(definitions);
		}

		List<Document> parts = new ArrayList<>();
		if (!imports.isEmpty()) {
			parts.add(imports.toDocument(options.indent));
		}
		parts.addAll(definitions.getFunctions());
		parts.addAll(definitions.getConstants());
		if (parts.isEmpty()) {
			return EMPTY;
		}
		logger.fine("module " + module.getName() + ": " + definitions.getFunctions().size() + " functions, " +
				definitions.getConstants().size() + " constants");
		return join(parts, lines(2)).append(line());
	}
}
