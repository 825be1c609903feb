package pygen.model.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class DocBuilder {
	private DocBuilder() {}

	public static final Document EMPTY = new DocConcat(Collections.emptyList());

	public static Document text(String text) {
		return new DocText(text);
	}

	public static Document line() {
		return new DocLine(1);
	}

	public static Document lines(int count) {
		return new DocLine(count);
	}

	public static Document breakable(String broken, String unbroken) {
		return new DocBreak(broken, unbroken);
	}

	public static Document concat(Document... documents) {
		return new DocConcat(Arrays.asList(documents));
	}

	public static Document join(List<Document> documents, Document separator) {
		List<Document> result = new ArrayList<>();
		for (Document document : documents) {
			if (!result.isEmpty()) {
				result.add(separator);
			}
			result.add(document);
		}
		return new DocConcat(result);
	}

	/**
	 * A comma separated list in parentheses. Laid out flat as "(a, b)" when it fits, otherwise as
	 * one element per line, indented by indent, with a trailing comma after the last element.
	 */
	public static Document wrapArguments(List<Document> arguments, int indent) {
		if (arguments.isEmpty()) {
			return text("()");
		}
		return concat(breakable("", ""), join(arguments, breakable(",", ", ")))
				.nest(indent)
				.append(breakable(",", ""))
				.surround("(", ")")
				.group();
	}
}
