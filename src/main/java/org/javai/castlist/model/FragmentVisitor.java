package org.javai.castlist.model;

/**
 * Visitor over the {@link Fragment} variants.
 *
 * @param <R> the result type
 */
public interface FragmentVisitor<R> {

	R visitInfo(Fragment.Info info);

	R visitAlias(Fragment.Alias alias);

	R visitGroup(Fragment.Group group);
}
