package org.javai.castlist.model;

/**
 * Structural problems the parser can report.
 */
public enum IssueCode {
	MISSING_NAME("Missing character/group name before fragments."),
	INVALID_MEMBER_ALIAS_ONLY("Member starts with '['; missing name."),
	INVALID_FRAGMENT_ORDER("Found '[' after '()'."),
	UNMATCHED_ROUND("Missing closing ')'."),
	NESTED_ROUND_NOT_ALLOWED("Nested '(' is not allowed."),
	UNMATCHED_SQUARE("Missing closing ']'."),
	AMBIGUOUS_SQUARE_LIST("Could be a group or aliases. Defaulted to alias."),
	EXTRA_CLOSING_ROUND("Found ')' with no matching '('."),
	EXTRA_CLOSING_SQUARE("Found ']' with no matching '['.");

	private final String defaultMessage;

	IssueCode(String defaultMessage) {
		this.defaultMessage = defaultMessage;
	}

	public String defaultMessage() {
		return defaultMessage;
	}
}
