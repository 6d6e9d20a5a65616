package org.javai.castlist.model;

import java.util.List;
import java.util.Objects;

/**
 * One bracketed annotation attached to a character name.
 *
 * <p>Every variant keeps the bracket interior as {@code raw}. For groups the raw text is
 * retained for diagnostics only; rendering always works from the parsed members.</p>
 */
public sealed interface Fragment {

	String raw();

	<R> R accept(FragmentVisitor<R> visitor);

	/**
	 * Contents of one {@code (...)}, kept whole even when comma separated.
	 */
	record Info(String raw) implements Fragment {

		public Info {
			Objects.requireNonNull(raw, "raw must not be null");
		}

		@Override
		public <R> R accept(FragmentVisitor<R> visitor) {
			return visitor.visitInfo(this);
		}
	}

	/**
	 * Contents of one {@code [...]} treated as an opaque label.
	 */
	record Alias(String raw) implements Fragment {

		public Alias {
			Objects.requireNonNull(raw, "raw must not be null");
		}

		@Override
		public <R> R accept(FragmentVisitor<R> visitor) {
			return visitor.visitAlias(this);
		}
	}

	/**
	 * Contents of one {@code [...]} read as a list of member characters.
	 */
	record Group(String raw, List<CastMember> members) implements Fragment {

		public Group {
			Objects.requireNonNull(raw, "raw must not be null");
			members = members != null ? List.copyOf(members) : List.of();
		}

		@Override
		public <R> R accept(FragmentVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}
}
