package org.javai.castlist.model;

/**
 * Visitor over the {@link CastMember} variants.
 *
 * @param <R> the result type
 */
public interface CastMemberVisitor<R> {

	R visitNode(CastMember.Node node);

	R visitRaw(CastMember.Raw raw);
}
