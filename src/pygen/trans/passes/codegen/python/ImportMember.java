package pygen.trans.passes.codegen.python;

import pygen.model.doc.DocBuilder;
import pygen.model.doc.Document;

import java.util.Objects;

/**
 * A name imported from a module, with the alias it is bound to locally (null when it keeps its name).
 */
public class ImportMember {

	private final String name;
	private final String alias;

	public ImportMember(String name, String alias) {
		this.name = name;
		this.alias = alias;
	}

	public String getName() {
		return name;
	}

	public String getAlias() {
		return alias;
	}

	public Document toDocument() {
		if (alias == null) {
			return DocBuilder.text(name);
		}
		return DocBuilder.text(name + " as " + alias);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ImportMember that = (ImportMember) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(alias, that.alias);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, alias);
	}

	@Override
	public String toString() {
		return toDocument().toString();
	}
}
