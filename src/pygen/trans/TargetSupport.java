package pygen.trans;

/**
 * Whether a construct with no Python lowering aborts the whole module or only omits the definition
 * that contains it.
 */
public enum TargetSupport {
	ENFORCED,
	OPTIONAL;

	public boolean isEnforced() {
		return this == ENFORCED;
	}
}
