package pygen;

/**
 * A PyGen Exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class PyGenException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public PyGenException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
