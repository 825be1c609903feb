package pygen.trans.passes.codegen.python;

import pygen.scope.ScopeTable;
import pygen.util.SourceSpan;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Renders source names as Python identifiers.
 *
 * A name that is a Python keyword is escaped by appending {@link #ESCAPE_SUFFIX}. Whether the escaped
 * name collides with another identifier is checked by the callers that know which names are in use.
 */
public final class Identifiers {
	private Identifiers() {}

	public static final String ESCAPE_SUFFIX = "_";

	// python -c "import keyword ; print(keyword.kwlist)"
	private static final Set<String> RESERVED_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"False",
			"None",
			"True",
			"and",
			"as",
			"assert",
			"async",
			"await",
			"break",
			"class",
			"continue",
			"def",
			"del",
			"elif",
			"else",
			"except",
			"finally",
			"for",
			"from",
			"global",
			"if",
			"import",
			"in",
			"is",
			"lambda",
			"nonlocal",
			"not",
			"or",
			"pass",
			"raise",
			"return",
			"try",
			"while",
			"with",
			"yield")));

	public static Set<String> reservedWords() {
		return RESERVED_WORDS;
	}

	public static boolean isUsable(String word) {
		return !RESERVED_WORDS.contains(word);
	}

	public static String escape(String word) {
		return word + ESCAPE_SUFFIX;
	}

	public static String maybeEscape(String word) {
		if (isUsable(word)) {
			return word;
		}
		return escape(word);
	}

	/**
	 * The reserved word that escapes to name, or null if name is not an escaped form.
	 */
	public static String unescaped(String name) {
		if (!name.endsWith(ESCAPE_SUFFIX)) {
			return null;
		}
		String word = name.substring(0, name.length() - ESCAPE_SUFFIX.length());
		if (isUsable(word)) {
			return null;
		}
		return word;
	}

	/**
	 * A variable at shadow counter 0 keeps its (escaped) name; later bindings get a "$n" suffix.
	 */
	public static String variableName(String name, int counter) {
		if (counter == 0) {
			return maybeEscape(name);
		}
		return name + "$" + counter;
	}

	public static String loopVariableName(String name) {
		return "loop$" + name;
	}

	/**
	 * Binds name in scope and returns the identifier the new binding renders as.
	 */
	public static String bindVariable(ScopeTable scope, String name, SourceSpan location) {
		int counter = scope.bind(name);
		if (counter == 0) {
			checkCollision(scope, name, location);
		}
		return variableName(name, counter);
	}

	/**
	 * The identifier a reference to name renders as in scope.
	 */
	public static String referenceVariable(ScopeTable scope, String name, SourceSpan location) {
		int counter = scope.reference(name);
		if (counter == 0) {
			checkCollision(scope, name, location);
		}
		return variableName(name, counter);
	}

	// only bindings at counter 0 render without a suffix, so only they can collide
	private static void checkCollision(ScopeTable scope, String name, SourceSpan location) {
		if (!isUsable(name)) {
			String escaped = escape(name);
			Integer other = scope.counter(escaped);
			if (other != null && other == 0) {
				throw new IdentifierCollisionIssue(name, escaped, location);
			}
		}
		String word = unescaped(name);
		if (word != null) {
			Integer other = scope.counter(word);
			if (other != null && other == 0) {
				throw new IdentifierCollisionIssue(word, name, location);
			}
		}
	}
}
