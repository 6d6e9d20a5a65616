package org.javai.castlist.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.Fragment;
import org.javai.castlist.model.IssueCode;

/**
 * Parses the text of one entry into a {@link CastMember.Node}.
 *
 * <p>The name is everything before the first bracket. What follows is read as a sequence
 * of fragments:</p>
 * <ul>
 * <li>{@code (...)} becomes one {@link Fragment.Info}, commas and all;</li>
 * <li>{@code [...]} whose interior contains another {@code [} becomes a
 * {@link Fragment.Group} whose members are parsed recursively;</li>
 * <li>any other {@code [...]} becomes a single {@link Fragment.Alias}. A top-level
 * separator inside it is reported as ambiguous but does not split it.</li>
 * </ul>
 * <p>Info fragments close a node's fragment list, so a {@code [} after a {@code (} is
 * reported as out of order. The fragment is still read.</p>
 *
 * <p>Group members recurse through {@link MemberListParser}, so stack depth grows with
 * the square bracket nesting depth of the input. Text nested deeply enough can exhaust
 * the thread stack.</p>
 */
public final class NodeParser {

	private final char separator;
	private final MemberListParser memberListParser;

	public NodeParser(char separator) {
		this.separator = separator;
		this.memberListParser = new MemberListParser(this, separator);
	}

	/**
	 * Parses one entry.
	 *
	 * @param entryRaw the entry text
	 * @param path locator for this entry, e.g. {@code top[0]}
	 * @param issues issue sink
	 * @return the node, or empty when no name precedes the first bracket
	 */
	public Optional<CastMember.Node> parse(String entryRaw, String path, IssueCollector issues) {
		int i = 0;
		while (i < entryRaw.length() && !isOpener(entryRaw.charAt(i))) {
			i++;
		}
		String name = entryRaw.substring(0, i).strip();
		if (name.isEmpty()) {
			issues.report(IssueCode.MISSING_NAME, entryRaw, path);
			return Optional.empty();
		}

		List<Fragment> fragments = new ArrayList<>();
		boolean seenInfo = false;
		while (i < entryRaw.length()) {
			char ch = entryRaw.charAt(i);
			if (ch == '(') {
				BracketSpan span = RoundGroupReader.read(entryRaw, i, path, issues);
				fragments.add(new Fragment.Info(span.inner().strip()));
				seenInfo = true;
				i = span.next();
			} else if (ch == '[') {
				if (seenInfo) {
					issues.report(IssueCode.INVALID_FRAGMENT_ORDER, entryRaw.substring(i), path);
				}
				BracketSpan span = SquareGroupReader.read(entryRaw, i, path, issues);
				fragments.add(squareFragment(span.inner(), path, issues));
				i = span.next();
			} else {
				// whitespace and stray text between fragments are ignored
				i++;
			}
		}
		return Optional.of(new CastMember.Node(name, fragments));
	}

	private Fragment squareFragment(String inner, String path, IssueCollector issues) {
		if (inner.indexOf('[') >= 0) {
			List<CastMember> members = memberListParser.parse(inner, path + ".group", issues);
			return new Fragment.Group(inner.strip(), members);
		}
		if (EntrySplitter.containsTopLevel(inner, separator, path + ".square", issues)) {
			issues.report(IssueCode.AMBIGUOUS_SQUARE_LIST, "[" + inner + "]", path);
		}
		return new Fragment.Alias(inner.strip());
	}

	private static boolean isOpener(char ch) {
		return ch == '[' || ch == '(';
	}
}
