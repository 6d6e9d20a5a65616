/**
 * Immutable tree produced by the parser.
 * <p>
 * {@link org.javai.castlist.model.CastMember} and {@link org.javai.castlist.model.Fragment}
 * are closed hierarchies. Code that must handle every variant goes through
 * {@link org.javai.castlist.model.CastMemberVisitor} and
 * {@link org.javai.castlist.model.FragmentVisitor}, so a new variant fails to compile
 * until every consumer handles it.
 */
package org.javai.castlist.model;
