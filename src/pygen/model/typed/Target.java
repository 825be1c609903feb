package pygen.model.typed;

public enum Target {
	ERLANG,
	JAVASCRIPT,
	PYTHON,
}
