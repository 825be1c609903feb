package pygen.scope;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shadow counters for the variable names bound during one traversal.
 *
 * The first binding of a name gets counter 0, and each later binding of the same name gets the next
 * counter. Tables are extended copy-on-write: {@link #child()} returns a table that sees every
 * binding of its parent, while bindings made in the child are never visible to the parent or to
 * sibling children.
 */
public class ScopeTable {
	private final Map<String, Integer> counters;

	public ScopeTable() {
		this(new HashMap<>());
	}

	private ScopeTable(Map<String, Integer> counters) {
		this.counters = counters;
	}

	public ScopeTable child() {
		return new ScopeTable(new ChainMap<>(counters));
	}

	/**
	 * A child table in which each of names is bound at counter 0, whatever it was bound to before.
	 */
	public ScopeTable withParameters(List<String> names) {
		ScopeTable table = child();
		for (String name : names) {
			table.counters.put(name, 0);
		}
		return table;
	}

	/**
	 * The counter a reference to name resolves to. A name never bound before is entered at 0.
	 */
	public int reference(String name) {
		Integer counter = counters.get(name);
		if (counter == null) {
			counters.put(name, 0);
			return 0;
		}
		return counter;
	}

	/**
	 * Binds name, returning 0 for its first binding and the incremented counter for a rebinding.
	 */
	public int bind(String name) {
		Integer previous = counters.get(name);
		int counter = previous == null ? 0 : previous + 1;
		counters.put(name, counter);
		return counter;
	}

	public boolean contains(String name) {
		return counters.containsKey(name);
	}

	public Integer counter(String name) {
		return counters.get(name);
	}
}
