/**
 * Bracket-aware scanning and the recursive node parser.
 */
package org.javai.castlist.parse;
