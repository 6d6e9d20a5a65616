package org.javai.castlist.model;

import java.util.List;

/**
 * Result of parsing a character list.
 *
 * <p>{@code entries} holds every reachable node exactly once, in depth-first order of
 * first visit. Group members therefore appear both inside their group fragment and as
 * entries of their own.</p>
 *
 * @param entries all nodes, flattened
 * @param issuesDetailed issues in the order they were found
 */
public record Dataset(List<CastMember.Node> entries, List<ParseIssue> issuesDetailed) {

	public Dataset {
		entries = entries != null ? List.copyOf(entries) : List.of();
		issuesDetailed = issuesDetailed != null ? List.copyOf(issuesDetailed) : List.of();
	}

	public static Dataset empty() {
		return new Dataset(List.of(), List.of());
	}

	public boolean hasIssues() {
		return !issuesDetailed.isEmpty();
	}

	public List<ParseIssue> issuesWithCode(IssueCode code) {
		return issuesDetailed.stream()
				.filter(issue -> issue.code() == code)
				.toList();
	}
}
