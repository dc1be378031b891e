package org.metricshub.suiwat;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.SuiSettings;

/**
 * Helpers shared by the SuiWat tests. {@link #program(String)} compiles a
 * program and runs the result with {@link WatRunner};
 * {@link #cli(String...)} runs the command line with captured output streams.
 */
public final class SuiTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("suiwat-test");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private SuiTestSupport() {}

	/**
	 * @param description used in assertion messages
	 * @return a builder for a program test
	 */
	public static ProgramTest program(String description) {
		return new ProgramTest(description);
	}

	/**
	 * Writes a source file in a temporary directory.
	 *
	 * @param name file name
	 * @param lines lines of the file
	 * @return the path of the file
	 * @throws IOException if the file cannot be written
	 */
	public static Path sourceFile(String name, String... lines) throws IOException {
		Path dir = Files.createTempDirectory(SHARED_TEMP_DIR, "src");
		Path file = dir.resolve(name);
		Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
		return file;
	}

	/**
	 * Runs the command line.
	 *
	 * @param args arguments
	 * @return exit code and captured streams
	 */
	public static CliResult cli(String... args) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int exitCode;
		try (PrintStream outStream = new PrintStream(out, true, "UTF-8");
				PrintStream errStream = new PrintStream(err, true, "UTF-8")) {
			exitCode = Cli.execute(args, outStream, errStream);
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
		return new CliResult(
				exitCode,
				new String(out.toByteArray(), StandardCharsets.UTF_8),
				new String(err.toByteArray(), StandardCharsets.UTF_8));
	}

	/**
	 * Builder of a test that compiles one program.
	 */
	public static final class ProgramTest {

		private final String description;
		private final SuiSettings settings = new SuiSettings();
		private String source = "";

		private ProgramTest(String description) {
			this.description = description;
		}

		/**
		 * @param lines the program, one line each
		 * @return this builder
		 */
		public ProgramTest lines(String... lines) {
			this.source = String.join("\n", lines) + "\n";
			return this;
		}

		public ProgramTest strict() {
			settings.setStrict(true);
			return this;
		}

		public ProgramTest unknownLabels(FallbackPolicy policy) {
			settings.setUnknownLabelPolicy(policy);
			return this;
		}

		public ProgramTest unresolvedValues(FallbackPolicy policy) {
			settings.setUnresolvedValuePolicy(policy);
			return this;
		}

		/**
		 * @return the module text
		 */
		public String compile() {
			return new SuiWat(settings).compile(source);
		}

		/**
		 * Compiles the program and calls its {@code main} export.
		 *
		 * @return the runner, after the call
		 */
		public Execution run() {
			WatRunner runner = WatRunner.load(compile());
			int result = runner.invoke("main");
			return new Execution(description, runner, result);
		}
	}

	/**
	 * Outcome of the {@code main} export of a compiled program.
	 */
	public static final class Execution {

		private final String description;
		private final WatRunner runner;
		private final int result;

		private Execution(String description, WatRunner runner, int result) {
			this.description = description;
			this.runner = runner;
			this.result = result;
		}

		public WatRunner runner() {
			return runner;
		}

		public int result() {
			return result;
		}

		public int global(int index) {
			return runner.global("g" + index);
		}

		public List<Integer> printed() {
			return runner.printed();
		}

		/**
		 * @param index global variable index
		 * @param expected its expected value
		 * @return this execution
		 */
		public Execution assertGlobal(int index, int expected) {
			assertEquals(description + ": g" + index, expected, global(index));
			return this;
		}

		/**
		 * @param expected values expected from the print import, in order
		 * @return this execution
		 */
		public Execution assertPrinted(Integer... expected) {
			assertEquals(description + ": printed values", Arrays.asList(expected), printed());
			return this;
		}
	}

	/**
	 * Exit code and output of one command line run.
	 */
	public static final class CliResult {

		private final int exitCode;
		private final String out;
		private final String err;

		CliResult(int exitCode, String out, String err) {
			this.exitCode = exitCode;
			this.out = out;
			this.err = err;
		}

		public int exitCode() {
			return exitCode;
		}

		public String out() {
			return out;
		}

		public String err() {
			return err;
		}
	}
}
