package org.javai.castlist.tools;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.castlist.CastListException;
import org.javai.castlist.CastListParser;
import org.javai.castlist.ParserOptions;
import org.javai.castlist.json.DatasetJsonMapper;
import org.javai.castlist.model.Dataset;
import org.javai.castlist.model.ParseIssue;
import org.javai.castlist.render.CanonicalRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line driver that canonicalizes character lists.
 *
 * <pre>
 * castlist [--json] [--issues] [--check] [--separator C] [file ...]
 * </pre>
 *
 * Reads each file, or standard input when no file is given, and prints its canonical
 * form (or the parsed dataset as JSON). With {@code --check} the canonical form is parsed
 * and rendered again and must come out unchanged.
 *
 * Exit codes: 0 on success, 1 when a canonical form is not stable, 2 on usage or I/O errors.
 */
public class CastListCli {

	private static final Logger logger = LoggerFactory.getLogger(CastListCli.class);

	static final int EXIT_OK = 0;
	static final int EXIT_UNSTABLE = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: castlist [--json] [--issues] [--check] [--separator C] [file ...]";

	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	public CastListCli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		int status = new CastListCli(System.in, System.out, System.err).run(args);
		System.exit(status);
	}

	/**
	 * Runs the driver.
	 *
	 * @param args command line arguments
	 * @return the exit code
	 */
	public int run(String[] args) {
		boolean json = false;
		boolean showIssues = false;
		boolean check = false;
		ParserOptions.Builder options = ParserOptions.builder();
		List<Path> files = new ArrayList<>();

		try {
			for (int i = 0; i < args.length; i++) {
				String arg = args[i];
				switch (arg) {
					case "--json" -> json = true;
					case "--issues" -> showIssues = true;
					case "--check" -> check = true;
					case "--separator" -> {
						if (i + 1 >= args.length || args[i + 1].length() != 1) {
							throw new IllegalArgumentException("--separator takes exactly one character");
						}
						options.separator(args[++i].charAt(0));
					}
					case "-h", "--help" -> {
						out.println(USAGE);
						return EXIT_OK;
					}
					default -> {
						if (arg.startsWith("--")) {
							throw new IllegalArgumentException("Unknown option: " + arg);
						}
						files.add(Path.of(arg));
					}
				}
			}

			ParserOptions parserOptions = options.build();
			CastListParser parser = new CastListParser(parserOptions);
			CanonicalRenderer renderer = new CanonicalRenderer(parserOptions);

			int status = EXIT_OK;
			if (files.isEmpty()) {
				status = process("<stdin>", readStdin(), parser, renderer, json, showIssues, check);
			} else {
				for (Path file : files) {
					int result = process(file.toString(), readFile(file), parser, renderer, json, showIssues, check);
					status = Math.max(status, result);
				}
			}
			return status;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		} catch (CastListException e) {
			logger.error("castlist failed: {}", e.getMessage(), e);
			err.println(e.getMessage());
			return EXIT_USAGE;
		}
	}

	private int process(String source, String text, CastListParser parser, CanonicalRenderer renderer,
			boolean json, boolean showIssues, boolean check) {
		Dataset dataset = parser.parse(text);
		String canonical = renderer.render(dataset);
		logger.info("Canonicalized {}: {} entries, {} issues",
				source, dataset.entries().size(), dataset.issuesDetailed().size());

		out.println(json ? DatasetJsonMapper.toPrettyString(dataset) : canonical);

		if (showIssues) {
			for (ParseIssue issue : dataset.issuesDetailed()) {
				err.println(source + ": " + issue);
			}
		}

		if (check) {
			String again = renderer.render(parser.parse(canonical));
			if (!again.equals(canonical)) {
				logger.warn("Canonical form of {} is not stable", source);
				err.println(source + ": idempotence violation");
				err.println("  first:  " + canonical);
				err.println("  second: " + again);
				return EXIT_UNSTABLE;
			}
		}
		return EXIT_OK;
	}

	private String readStdin() {
		try {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new CastListException("Could not read standard input", e);
		}
	}

	private static String readFile(Path file) {
		try {
			return Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new CastListException("Could not read " + file + ": " + e.getMessage(), e);
		}
	}
}
