package org.javai.castlist.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text at separators that sit at bracket depth zero.
 */
public final class EntrySplitter {

	private EntrySplitter() {
		// Utility class - no instantiation
	}

	/**
	 * Splits {@code text} at every top-level {@code separator}. The segment after the last
	 * separator is always included, even when empty. Pieces are neither trimmed nor filtered.
	 *
	 * @param text the text to split
	 * @param separator the separator character
	 * @param path locator for extra-closer issues
	 * @param issues issue sink
	 * @return the pieces in textual order, never empty
	 */
	public static List<String> split(String text, char separator, String path, IssueCollector issues) {
		List<String> pieces = new ArrayList<>();
		int[] start = {0};
		BracketScanner.scan(text, path, issues, (ch, index) -> {
			if (ch == separator) {
				pieces.add(text.substring(start[0], index));
				start[0] = index + 1;
			}
			return true;
		});
		pieces.add(text.substring(start[0]));
		return pieces;
	}

	/**
	 * Checks whether {@code text} contains the separator at top level. The whole text is
	 * scanned so that every stray closer is reported.
	 */
	public static boolean containsTopLevel(String text, char separator, String path, IssueCollector issues) {
		boolean[] found = {false};
		BracketScanner.scan(text, path, issues, (ch, index) -> {
			if (ch == separator) {
				found[0] = true;
			}
			return true;
		});
		return found[0];
	}
}
