package pygen;

public class PyGenOptionException extends PyGenException {

	private static final String prefix = "Option Error";

	public PyGenOptionException(String msg) {
		super(prefix, msg);
	}

}
