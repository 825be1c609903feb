package pygen.model.typed;

public enum Publicity {
	PUBLIC,
	PRIVATE,
}
