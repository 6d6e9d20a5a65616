package org.javai.castlist;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.ParseIssue;
import org.javai.castlist.parse.DatasetAssembler;
import org.javai.castlist.parse.EntrySplitter;
import org.javai.castlist.parse.IssueCollector;
import org.javai.castlist.parse.NodeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conservative parser for character lists such as
 * {@code Justice League [Wonder Woman; Batman [Bruce Wayne]]; Jimmy Olsen (origin, death);}.
 *
 * <p>Parsing never fails. Structural problems are returned as issues in the
 * {@link Dataset}, and the tree holds as much as could be read from the text without
 * guessing. Entries with no name are dropped rather than given a placeholder.</p>
 *
 * <p>Instances are immutable and may be shared across threads; every call to
 * {@link #parse(String)} uses its own issue collector.</p>
 *
 * Example usage:
 *
 * <pre>
 * CastListParser parser = new CastListParser();
 * Dataset dataset = parser.parse("Superman [Clark Kent]; Batman;");
 * String canonical = new CanonicalRenderer().render(dataset);
 * </pre>
 */
public class CastListParser {

	private static final Logger logger = LoggerFactory.getLogger(CastListParser.class);

	static final String INPUT_PATH = "input";

	private final ParserOptions options;
	private final NodeParser nodeParser;

	public CastListParser() {
		this(ParserOptions.defaults());
	}

	public CastListParser(ParserOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.nodeParser = new NodeParser(options.separator());
	}

	public ParserOptions options() {
		return options;
	}

	/**
	 * Parses the whole input.
	 *
	 * @param input character list text; null is treated as empty
	 * @return the flattened dataset with every issue found
	 */
	public Dataset parse(String input) {
		String text = input != null ? input : "";
		IssueCollector issues = new IssueCollector(options.recordPaths());

		List<String> parts = EntrySplitter.split(text, options.separator(), INPUT_PATH, issues);
		List<CastMember.Node> topLevel = new ArrayList<>();
		for (int i = 0; i < parts.size(); i++) {
			String entry = parts.get(i).strip();
			if (entry.isEmpty()) {
				continue;
			}
			nodeParser.parse(entry, "top[" + i + "]", issues).ifPresent(topLevel::add);
		}

		Dataset dataset = DatasetAssembler.assemble(topLevel, issues.issues());
		logger.debug("Parsed {} entries ({} top-level) with {} issues",
				dataset.entries().size(), topLevel.size(), dataset.issuesDetailed().size());
		if (logger.isTraceEnabled()) {
			for (ParseIssue issue : dataset.issuesDetailed()) {
				logger.trace("Parse issue: {}", issue);
			}
		}
		return dataset;
	}
}
