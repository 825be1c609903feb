package pygen.model.typed;

import java.util.Objects;

/**
 * The "as" clause of an import: either a name the module is bound to, or a discard such as "_json"
 * that binds nothing.
 */
public class TypedImportAlias {

	public enum Kind {
		NAMED,
		DISCARD,
	}

	private final Kind kind;
	private final String name;

	public TypedImportAlias(Kind kind, String name) {
		this.kind = kind;
		this.name = name;
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	public boolean isDiscard() {
		return kind == Kind.DISCARD;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TypedImportAlias that = (TypedImportAlias) o;
		return kind == that.kind &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name);
	}
}
