package org.javai.castlist.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.javai.castlist.model.CastMember;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.Fragment;
import org.javai.castlist.model.ParseIssue;

/**
 * Flattens parsed top-level nodes into a {@link Dataset}.
 *
 * <p>Nodes are visited depth first, left to right, and each node object is added the first
 * time it is reached. Raw members are not visited. The visited set is keyed on identity;
 * the grammar cannot produce cycles, but the guard keeps traversal finite if it ever
 * did.</p>
 */
public final class DatasetAssembler {

	private DatasetAssembler() {
		// Utility class - no instantiation
	}

	public static Dataset assemble(List<CastMember.Node> topLevel, List<ParseIssue> issues) {
		List<CastMember.Node> entries = new ArrayList<>();
		Set<CastMember.Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (CastMember.Node node : topLevel) {
			visit(node, seen, entries);
		}
		return new Dataset(entries, issues);
	}

	private static void visit(CastMember.Node node, Set<CastMember.Node> seen, List<CastMember.Node> entries) {
		if (!seen.add(node)) {
			return;
		}
		entries.add(node);
		for (Fragment fragment : node.fragments()) {
			if (fragment instanceof Fragment.Group group) {
				for (CastMember member : group.members()) {
					if (member instanceof CastMember.Node child) {
						visit(child, seen, entries);
					}
				}
			}
		}
	}
}
