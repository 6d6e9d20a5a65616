package org.javai.castlist.parse;

/**
 * Result of reading one bracketed span.
 *
 * @param inner the text between the brackets (or after the opener, when unmatched)
 * @param next index of the first character after the span
 */
public record BracketSpan(String inner, int next) {
}
