package org.javai.castlist.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.castlist.model.IssueCode;
import org.javai.castlist.model.ParseIssue;

/**
 * Ordered, append-only sink for the issues found during one parse.
 *
 * <p>A collector belongs to a single parse invocation and is passed explicitly through
 * every reader and parser it calls. It is not thread-safe and must not be shared.</p>
 */
public final class IssueCollector {

	private final List<ParseIssue> issues = new ArrayList<>();
	private final boolean recordPaths;

	public IssueCollector() {
		this(true);
	}

	/**
	 * @param recordPaths whether reported issues keep their structural locator
	 */
	public IssueCollector(boolean recordPaths) {
		this.recordPaths = recordPaths;
	}

	/**
	 * Appends an issue carrying the code's default message.
	 *
	 * @param code the issue code
	 * @param raw the offending text
	 * @param path where in the structure the text was found
	 */
	public void report(IssueCode code, String raw, String path) {
		issues.add(new ParseIssue(code, raw, recordPaths ? path : null, code.defaultMessage()));
	}

	public List<ParseIssue> issues() {
		return Collections.unmodifiableList(issues);
	}

	public int size() {
		return issues.size();
	}

	public boolean isEmpty() {
		return issues.isEmpty();
	}
}
