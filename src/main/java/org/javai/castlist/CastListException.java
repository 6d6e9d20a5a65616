package org.javai.castlist;

/**
 * Unchecked failure outside parsing itself, such as reading input or writing JSON.
 * Problems in the parsed text are reported as issues, never through this exception.
 */
public class CastListException extends RuntimeException {

	public CastListException(String message) {
		super(message);
	}

	public CastListException(String message, Throwable cause) {
		super(message, cause);
	}
}
