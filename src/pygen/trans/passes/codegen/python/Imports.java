package pygen.trans.passes.codegen.python;

import pygen.model.doc.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static pygen.model.doc.DocBuilder.*;

/**
 * The import statements of a generated module, keyed by dotted module path.
 *
 * The empty path holds modules imported by name ("import a as b"). Any other path may be imported
 * as a whole ("import a") and may have members ("from a import (b, c)"). Members of a path are
 * unique and keep the order they were registered in; paths are written in sorted order.
 */
public class Imports {

	public static final String BARE_PATH = "";

	private static class Entry {
		boolean wholeModule = false;
		final Set<ImportMember> members = new LinkedHashSet<>();
	}

	private final Map<String, Entry> entries = new TreeMap<>();

	public void registerModule(String path) {
		entry(path).wholeModule = true;
	}

	public void registerMember(String path, ImportMember member) {
		entry(path).members.add(member);
	}

	public void registerMembers(String path, List<ImportMember> members) {
		entry(path).members.addAll(members);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public Set<String> getPaths() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public boolean isWholeModule(String path) {
		Entry entry = entries.get(path);
		return entry != null && entry.wholeModule;
	}

	public List<ImportMember> getMembers(String path) {
		Entry entry = entries.get(path);
		if (entry == null) {
			return Collections.emptyList();
		}
		return new ArrayList<>(entry.members);
	}

	public Document toDocument(int indent) {
		List<Document> statements = new ArrayList<>();
		for (Map.Entry<String, Entry> e : entries.entrySet()) {
			String path = e.getKey();
			Entry entry = e.getValue();
			if (path.equals(BARE_PATH)) {
				for (ImportMember member : entry.members) {
					statements.add(text("import ").append(member.toDocument()));
				}
				continue;
			}
			if (entry.wholeModule) {
				statements.add(text("import " + path));
			}
			if (!entry.members.isEmpty()) {
				List<Document> members = new ArrayList<>();
				for (ImportMember member : entry.members) {
					members.add(member.toDocument());
				}
				statements.add(text("from " + path + " import ").append(wrapArguments(members, indent)));
			}
		}
		return join(statements, line());
	}

	private Entry entry(String path) {
		return entries.computeIfAbsent(path, p -> new Entry());
	}
}
