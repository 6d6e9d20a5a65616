package org.javai.castlist.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.IssueCode;

/**
 * Parses the interior of a group into its members.
 *
 * <p>A member that starts with {@code [} has no name; it is kept verbatim as
 * {@link CastMember.Raw} and reported. A member whose name is missing for any other
 * reason is left out, its issue having been reported by the {@link NodeParser}.</p>
 */
public final class MemberListParser {

	private final NodeParser nodeParser;
	private final char separator;

	public MemberListParser(NodeParser nodeParser, char separator) {
		this.nodeParser = Objects.requireNonNull(nodeParser, "nodeParser must not be null");
		this.separator = separator;
	}

	/**
	 * @param inner group interior, without the enclosing brackets
	 * @param path locator of the group, e.g. {@code top[0].group}
	 * @param issues issue sink
	 * @return members in textual order
	 */
	public List<CastMember> parse(String inner, String path, IssueCollector issues) {
		List<String> pieces = EntrySplitter.split(inner, separator, path, issues);
		List<CastMember> members = new ArrayList<>();
		for (int k = 0; k < pieces.size(); k++) {
			String piece = pieces.get(k).strip();
			if (piece.isEmpty()) {
				continue;
			}
			String memberPath = path + "[" + k + "]";
			if (piece.charAt(0) == '[') {
				members.add(new CastMember.Raw(piece));
				issues.report(IssueCode.INVALID_MEMBER_ALIAS_ONLY, piece, memberPath);
				continue;
			}
			nodeParser.parse(piece, memberPath, issues).ifPresent(members::add);
		}
		return members;
	}
}
