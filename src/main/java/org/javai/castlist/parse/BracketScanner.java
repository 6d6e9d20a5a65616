package org.javai.castlist.parse;

import org.javai.castlist.model.IssueCode;

/**
 * Scans text while tracking round and square bracket depth independently.
 *
 * <p>Only characters at top level (both depths zero) are handed to the callback. Bracket
 * characters themselves are never handed over. A closer with no matching opener is
 * reported with the rest of the text from that closer on, and the depth stays at zero.</p>
 */
public final class BracketScanner {

	private BracketScanner() {
		// Utility class - no instantiation
	}

	/**
	 * Receives top-level characters.
	 */
	@FunctionalInterface
	public interface TopLevelCallback {

		/**
		 * @param ch the character
		 * @param index its index in the scanned text
		 * @return false to stop scanning
		 */
		boolean onTopLevel(char ch, int index);
	}

	/**
	 * Scans {@code text} from left to right.
	 *
	 * @param text the text to scan
	 * @param path locator attached to extra-closer issues
	 * @param issues sink for extra-closer issues
	 * @param callback receives each top-level character
	 * @return true if the whole text was scanned, false if the callback stopped it
	 */
	public static boolean scan(String text, String path, IssueCollector issues, TopLevelCallback callback) {
		int round = 0;
		int square = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			switch (ch) {
				case '(' -> round++;
				case ')' -> {
					if (round > 0) {
						round--;
					} else {
						issues.report(IssueCode.EXTRA_CLOSING_ROUND, text.substring(i), path);
					}
				}
				case '[' -> square++;
				case ']' -> {
					if (square > 0) {
						square--;
					} else {
						issues.report(IssueCode.EXTRA_CLOSING_SQUARE, text.substring(i), path);
					}
				}
				default -> {
					if (round == 0 && square == 0 && !callback.onTopLevel(ch, i)) {
						return false;
					}
				}
			}
		}
		return true;
	}
}
