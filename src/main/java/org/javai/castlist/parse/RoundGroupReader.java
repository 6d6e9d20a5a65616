package org.javai.castlist.parse;

import org.javai.castlist.model.IssueCode;

/**
 * Reads one {@code (...)} span.
 *
 * <p>Round brackets must not nest, but nested pairs are still counted so that the reader
 * stops at the matching closer. Nesting is reported and the inner text is returned
 * untouched.</p>
 */
public final class RoundGroupReader {

	private RoundGroupReader() {
		// Utility class - no instantiation
	}

	/**
	 * @param text the text containing the span
	 * @param start index of the opening {@code (}
	 * @param path locator for reported issues
	 * @param issues issue sink
	 * @return the inner text and the index after the closing {@code )}; when no closer
	 * exists, everything after the opener and the text length
	 */
	public static BracketSpan read(String text, int start, String path, IssueCollector issues) {
		int innerStart = start + 1;
		int depth = 1;
		boolean nested = false;
		for (int i = innerStart; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '(') {
				depth++;
				nested = true;
			} else if (ch == ')') {
				depth--;
				if (depth == 0) {
					if (nested) {
						issues.report(IssueCode.NESTED_ROUND_NOT_ALLOWED, text.substring(start, i + 1), path);
					}
					return new BracketSpan(text.substring(innerStart, i), i + 1);
				}
			}
		}
		issues.report(IssueCode.UNMATCHED_ROUND, text.substring(start), path);
		return new BracketSpan(text.substring(innerStart), text.length());
	}
}
