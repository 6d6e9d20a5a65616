package org.javai.castlist.model;

import java.util.List;
import java.util.Objects;

/**
 * A character as it appears in a parsed list: either a named node or, for group
 * members that have no name, the raw member text.
 */
public sealed interface CastMember {

	<R> R accept(CastMemberVisitor<R> visitor);

	/**
	 * A named character with its fragments in textual order.
	 *
	 * <p>Nodes are compared by identity wherever the parser or renderer tracks them;
	 * two distinct entries may carry identical names and fragments.</p>
	 *
	 * @param name stripped, non-empty name
	 * @param fragments fragments in the order they appear in the text
	 */
	record Node(String name, List<Fragment> fragments) implements CastMember {

		public Node {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isBlank()) {
				throw new IllegalArgumentException("name must not be blank");
			}
			fragments = fragments != null ? List.copyOf(fragments) : List.of();
		}

		public static Node of(String name, Fragment... fragments) {
			return new Node(name, List.of(fragments));
		}

		@Override
		public <R> R accept(CastMemberVisitor<R> visitor) {
			return visitor.visitNode(this);
		}
	}

	/**
	 * A group member that starts with a bracket and therefore has no name.
	 *
	 * @param raw the member text as it appeared between separators
	 */
	record Raw(String raw) implements CastMember {

		public Raw {
			Objects.requireNonNull(raw, "raw must not be null");
		}

		@Override
		public <R> R accept(CastMemberVisitor<R> visitor) {
			return visitor.visitRaw(this);
		}
	}
}
