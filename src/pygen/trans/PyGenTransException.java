package pygen.trans;

import pygen.PyGenException;

/**
 * Exception during typed AST to Python translation
 *
 */
public class PyGenTransException extends PyGenException {

	private static final String prefix = "Translation Error";

	public PyGenTransException(String msg) {
		super(prefix, msg);
	}

}
