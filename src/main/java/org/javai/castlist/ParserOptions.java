package org.javai.castlist;

/**
 * Options shared by {@link CastListParser} and the canonical renderer.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ParserOptions options = ParserOptions.defaults();
 *
 * // Custom configuration
 * ParserOptions options = ParserOptions.builder()
 *         .separator('|')
 *         .recordPaths(false)
 *         .build();
 * }</pre>
 *
 * @param separator character separating entries and group members
 * @param recordPaths whether issues carry a structural locator
 */
public record ParserOptions(
		char separator,
		boolean recordPaths
) {

	/**
	 * Default entry and member separator.
	 */
	public static final char DEFAULT_SEPARATOR = ';';

	public ParserOptions {
		if (separator == '(' || separator == ')' || separator == '[' || separator == ']') {
			throw new IllegalArgumentException("separator must not be a bracket character: '" + separator + "'");
		}
		if (Character.isWhitespace(separator)) {
			throw new IllegalArgumentException("separator must not be whitespace");
		}
	}

	/**
	 * Creates options with default values.
	 *
	 * @return default options
	 */
	public static ParserOptions defaults() {
		return new ParserOptions(DEFAULT_SEPARATOR, true);
	}

	/**
	 * Creates a new builder for custom options.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ParserOptions}.
	 */
	public static class Builder {
		private char separator = DEFAULT_SEPARATOR;
		private boolean recordPaths = true;

		private Builder() {}

		/**
		 * Sets the separator used between entries and between group members.
		 * The renderer joins with the same character followed by a space.
		 *
		 * @param separator any character other than a bracket or whitespace
		 * @return this builder
		 */
		public Builder separator(char separator) {
			this.separator = separator;
			return this;
		}

		/**
		 * Sets whether issues keep their structural path.
		 *
		 * @param recordPaths false to drop paths from reported issues
		 * @return this builder
		 */
		public Builder recordPaths(boolean recordPaths) {
			this.recordPaths = recordPaths;
			return this;
		}

		/**
		 * Builds the options.
		 *
		 * @return the options
		 */
		public ParserOptions build() {
			return new ParserOptions(separator, recordPaths);
		}
	}
}
