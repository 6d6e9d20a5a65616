package org.javai.castlist.parse;

import org.javai.castlist.model.IssueCode;

/**
 * Reads one balanced {@code [...]} span. Square brackets may nest.
 *
 * <p>Round spans inside are read with {@link RoundGroupReader}, so a {@code ]} inside
 * parentheses does not close the square span. Issues from those inner reads are located
 * under {@code <path>.square}.</p>
 */
public final class SquareGroupReader {

	private SquareGroupReader() {
		// Utility class - no instantiation
	}

	/**
	 * @param text the text containing the span
	 * @param start index of the opening {@code [}
	 * @param path locator of the enclosing node
	 * @param issues issue sink
	 * @return the inner text and the index after the matching {@code ]}; when no closer
	 * exists, everything after the opener and the text length
	 */
	public static BracketSpan read(String text, int start, String path, IssueCollector issues) {
		int innerStart = start + 1;
		int depth = 1;
		int i = innerStart;
		while (i < text.length()) {
			char ch = text.charAt(i);
			if (ch == '[') {
				depth++;
			} else if (ch == ']') {
				depth--;
				if (depth == 0) {
					return new BracketSpan(text.substring(innerStart, i), i + 1);
				}
			} else if (ch == '(') {
				i = RoundGroupReader.read(text, i, path + ".square", issues).next();
				continue;
			}
			i++;
		}
		issues.report(IssueCode.UNMATCHED_SQUARE, text.substring(start), path);
		return new BracketSpan(text.substring(innerStart), text.length());
	}
}
