package org.javai.castlist.tools;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.castlist.testsupport.LogCapture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CastListCliTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String stdin, String... args) {
		CastListCli cli = new CastListCli(
				new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
		return cli.run(args);
	}

	private String stdout() {
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr() {
		return err.toString(StandardCharsets.UTF_8);
	}

	@Test
	void canonicalizesStandardInput() {
		int status = run("Batman;\nSuperman (death);\n", "--check");

		assertThat(status).isEqualTo(CastListCli.EXIT_OK);
		assertThat(stdout().strip()).isEqualTo("Batman; Superman (death);");
		assertThat(stderr()).isEmpty();
	}

	@Test
	void unstableCanonicalFormFailsCheck() {
		int status = run("A [x (y]", "--check");

		assertThat(status).isEqualTo(CastListCli.EXIT_UNSTABLE);
		assertThat(stdout().strip()).isEqualTo("A [x (y]];");
		assertThat(stderr())
				.contains("<stdin>: idempotence violation")
				.contains("first:  A [x (y]];")
				.contains("second: A [x (y]];];");
	}

	@Test
	void canonicalizesFiles(@TempDir Path dir) throws IOException {
		Path first = Files.writeString(dir.resolve("first.txt"), "Flash [Barry Allen]");
		Path second = Files.writeString(dir.resolve("second.txt"), "[Solo]; Robin");

		int status = run("", "--issues", first.toString(), second.toString());

		assertThat(status).isEqualTo(CastListCli.EXIT_OK);
		assertThat(stdout().lines()).containsExactly("Flash [Barry Allen];", "Robin;");
		assertThat(stderr()).contains(second + ": MISSING_NAME at top[0]");
	}

	@Test
	void printsJson() {
		int status = run("Superman [Clark Kent];", "--json");

		assertThat(status).isEqualTo(CastListCli.EXIT_OK);
		assertThat(stdout()).contains("\"entries\"").contains("\"name\" : \"Superman\"");
	}

	@Test
	void honoursSeparatorOption() {
		int status = run("Alpha | Beta [x; y]", "--separator", "|");

		assertThat(status).isEqualTo(CastListCli.EXIT_OK);
		assertThat(stdout().strip()).isEqualTo("Alpha| Beta [x; y]|");
	}

	@Test
	void rejectsUnknownOption() {
		int status = run("", "--frobnicate");

		assertThat(status).isEqualTo(CastListCli.EXIT_USAGE);
		assertThat(stderr()).contains("Unknown option: --frobnicate").contains("Usage:");
	}

	@Test
	void rejectsBracketSeparator() {
		int status = run("", "--separator", "[");

		assertThat(status).isEqualTo(CastListCli.EXIT_USAGE);
		assertThat(stderr()).contains("separator must not be a bracket character");
	}

	@Test
	void missingFileIsReported(@TempDir Path dir) {
		Path missing = dir.resolve("missing.txt");

		int status = run("", missing.toString());

		assertThat(status).isEqualTo(CastListCli.EXIT_USAGE);
		assertThat(stderr()).contains("Could not read " + missing);
	}

	@Test
	void logsEachInput() {
		try (LogCapture logs = LogCapture.of(CastListCli.class, Level.INFO)) {
			run("Batman [Bruce Wayne]; [Solo]");

			assertThat(logs.messagesAt(Level.INFO))
					.containsExactly("Canonicalized <stdin>: 1 entries, 1 issues");
		}
	}
}
