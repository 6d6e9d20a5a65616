package org.javai.castlist.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import org.javai.castlist.model.IssueCode;
import org.javai.castlist.model.ParseIssue;
import org.junit.jupiter.api.Test;

class SquareGroupReaderTest {

	private final IssueCollector issues = new IssueCollector();

	@Test
	void readsSimpleSpan() {
		BracketSpan span = SquareGroupReader.read("[x] y", 0, "top[0]", issues);

		assertThat(span.inner()).isEqualTo("x");
		assertThat(span.next()).isEqualTo(3);
	}

	@Test
	void squareBracketsNest() {
		BracketSpan span = SquareGroupReader.read("[a [b] c]!", 0, "top[0]", issues);

		assertThat(span.inner()).isEqualTo("a [b] c");
		assertThat(span.next()).isEqualTo(9);
		assertThat(issues.isEmpty()).isTrue();
	}

	@Test
	void closerInsideRoundSpanDoesNotEndSquareSpan() {
		BracketSpan span = SquareGroupReader.read("[a (b]) c]", 0, "top[0]", issues);

		assertThat(span.inner()).isEqualTo("a (b]) c");
		assertThat(span.next()).isEqualTo(10);
		assertThat(issues.isEmpty()).isTrue();
	}

	@Test
	void roundIssuesInsideAreLocatedInSquareContext() {
		SquareGroupReader.read("[a ((b)) c]", 0, "top[0]", issues);

		assertThat(issues.issues()).singleElement()
				.satisfies(issue -> {
					assertThat(issue.code()).isEqualTo(IssueCode.NESTED_ROUND_NOT_ALLOWED);
					assertThat(issue.raw()).isEqualTo("((b))");
					assertThat(issue.path()).isEqualTo("top[0].square");
				});
	}

	@Test
	void unmatchedSquareConsumesToEnd() {
		BracketSpan span = SquareGroupReader.read("[abc", 0, "top[2]", issues);

		assertThat(span.inner()).isEqualTo("abc");
		assertThat(span.next()).isEqualTo(4);
		assertThat(issues.issues()).singleElement()
				.satisfies(issue -> {
					assertThat(issue.code()).isEqualTo(IssueCode.UNMATCHED_SQUARE);
					assertThat(issue.raw()).isEqualTo("[abc");
					assertThat(issue.path()).isEqualTo("top[2]");
				});
	}

	@Test
	void unmatchedRoundInsideAlsoLeavesSquareUnmatched() {
		BracketSpan span = SquareGroupReader.read("[a (b]", 0, "top[0]", issues);

		assertThat(span.next()).isEqualTo(6);
		assertThat(issues.issues())
				.extracting(ParseIssue::code, ParseIssue::raw)
				.containsExactly(
						tuple(IssueCode.UNMATCHED_ROUND, "(b]"),
						tuple(IssueCode.UNMATCHED_SQUARE, "[a (b]"));
	}
}
