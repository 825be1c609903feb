package pygen.model.typed;

/**
 * What a referenced name resolved to during type checking.
 */
public enum ValueConstructorKind {
	LOCAL_VARIABLE,
	MODULE_FUNCTION,
	MODULE_CONSTANT,
	RECORD,
}
