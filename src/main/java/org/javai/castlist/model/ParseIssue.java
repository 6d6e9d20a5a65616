package org.javai.castlist.model;

import java.util.Objects;

/**
 * A structural issue found while parsing.
 *
 * @param code what went wrong
 * @param raw the offending span of text
 * @param path structural locator such as {@code top[1].group[0]}, or null when paths are not recorded
 * @param message human readable description, may be null
 */
public record ParseIssue(IssueCode code, String raw, String path, String message) {

	public ParseIssue {
		Objects.requireNonNull(code, "code must not be null");
		Objects.requireNonNull(raw, "raw must not be null");
	}

	public static ParseIssue of(IssueCode code, String raw) {
		return new ParseIssue(code, raw, null, null);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(code.name());
		if (path != null) {
			sb.append(" at ").append(path);
		}
		sb.append(": '").append(raw).append('\'');
		if (message != null) {
			sb.append(" (").append(message).append(')');
		}
		return sb.toString();
	}
}
