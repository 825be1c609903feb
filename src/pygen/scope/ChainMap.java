package pygen.scope;

import java.util.AbstractMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 *
 * A map that extends another map. Lookups fall back to the parent, but modifications only affect
 * the local map, never the parent.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class ChainMap<K, V> extends AbstractMap<K, V> {
	private final Map<K, V> parent;
	private final Map<K, V> members = new HashMap<>();

	public ChainMap(Map<K, V> parent) {
		this.parent = parent;
	}

	public Map<K, V> getParent() {
		return parent;
	}

	@Override
	public boolean containsKey(Object k) {
		return members.containsKey(k) || parent.containsKey(k);
	}

	@Override
	public V get(Object k) {
		if (members.containsKey(k)) {
			return members.get(k);
		}
		return parent.get(k);
	}

	@Override
	public V put(K k, V v) {
		V previous = get(k);
		members.put(k, v);
		return previous;
	}

	/**
	 * Only removes local members; a key inherited from the parent stays visible.
	 */
	@Override
	public V remove(Object k) {
		return members.remove(k);
	}

	@Override
	public void clear() {
		members.clear();
	}

	// a snapshot: local members shadow the parent's entries
	@Override
	public Set<Entry<K, V>> entrySet() {
		Map<K, V> result = new LinkedHashMap<>(parent);
		result.putAll(members);
		return result.entrySet();
	}
}
