package org.javai.castlist.render;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.castlist.ParserOptions;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.CastMemberVisitor;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.Fragment;
import org.javai.castlist.model.FragmentVisitor;

/**
 * Renders a {@link Dataset} back to its canonical text.
 *
 * <p>Only root entries are written at top level: an entry that is a member of some group
 * is written inside that group instead. Each root is its name followed by its fragments in
 * order, each preceded by one space. Groups are rebuilt from their parsed members, never
 * from their raw text. Roots are joined by the separator and a space, and non-empty output
 * ends with the separator.</p>
 *
 * <p>For input whose fragments close every bracket they open, rendering the result of
 * parsing canonical text yields the same text again. An unclosed {@code (} inside a
 * square fragment, as in {@code A [x (y]}, swallows the closing {@code ]} and the output
 * grows by one {@code ];} on each pass.</p>
 */
public class CanonicalRenderer implements CastMemberVisitor<String>, FragmentVisitor<String> {

	private final char separator;
	private final String joiner;

	public CanonicalRenderer() {
		this(ParserOptions.defaults());
	}

	public CanonicalRenderer(ParserOptions options) {
		Objects.requireNonNull(options, "options must not be null");
		this.separator = options.separator();
		this.joiner = separator + " ";
	}

	/**
	 * Renders the dataset.
	 *
	 * @param dataset a parsed dataset
	 * @return the canonical text, empty when there are no roots
	 */
	public String render(Dataset dataset) {
		List<CastMember.Node> roots = roots(dataset);
		if (roots.isEmpty()) {
			return "";
		}
		return roots.stream()
				.map(this::visitNode)
				.collect(Collectors.joining(joiner)) + separator;
	}

	/**
	 * Entries not referenced as a member of any group, in entry order.
	 * Membership is decided by identity.
	 */
	public List<CastMember.Node> roots(Dataset dataset) {
		Objects.requireNonNull(dataset, "dataset must not be null");
		Set<CastMember.Node> members = Collections.newSetFromMap(new IdentityHashMap<>());
		for (CastMember.Node entry : dataset.entries()) {
			for (Fragment fragment : entry.fragments()) {
				if (fragment instanceof Fragment.Group group) {
					for (CastMember member : group.members()) {
						if (member instanceof CastMember.Node node) {
							members.add(node);
						}
					}
				}
			}
		}
		return dataset.entries().stream()
				.filter(entry -> !members.contains(entry))
				.toList();
	}

	@Override
	public String visitNode(CastMember.Node node) {
		StringBuilder out = new StringBuilder(node.name().strip());
		for (Fragment fragment : node.fragments()) {
			out.append(' ').append(fragment.accept(this));
		}
		return out.toString();
	}

	@Override
	public String visitRaw(CastMember.Raw raw) {
		return raw.raw().strip();
	}

	@Override
	public String visitInfo(Fragment.Info info) {
		return "(" + info.raw().strip() + ")";
	}

	@Override
	public String visitAlias(Fragment.Alias alias) {
		return "[" + alias.raw().strip() + "]";
	}

	@Override
	public String visitGroup(Fragment.Group group) {
		return group.members().stream()
				.map(member -> member.accept(this))
				.collect(Collectors.joining(joiner, "[", "]"));
	}
}
