package org.javai.castlist;

import org.javai.castlist.model.Dataset;
import org.javai.castlist.render.CanonicalRenderer;

/**
 * Entry points using the default options.
 */
public final class CastList {

	private static final CastListParser PARSER = new CastListParser();
	private static final CanonicalRenderer RENDERER = new CanonicalRenderer();

	private CastList() {
		// Utility class - no instantiation
	}

	public static Dataset parse(String input) {
		return PARSER.parse(input);
	}

	public static String render(Dataset dataset) {
		return RENDERER.render(dataset);
	}

	/**
	 * Parses and renders in one step.
	 */
	public static String canonicalize(String input) {
		return RENDERER.render(PARSER.parse(input));
	}
}
