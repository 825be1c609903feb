package pygen;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String reason) {
		super("internal compiler error: " + reason);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
