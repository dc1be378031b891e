package org.metricshub.suiwat;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * SuiWat
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.metricshub.suiwat.util.ScriptFileSource;
import org.metricshub.suiwat.util.SuiLogger;
import org.metricshub.suiwat.util.SuiSettings;
import org.metricshub.suiwat.util.SuiSettings.OutputFormat;
import org.slf4j.Logger;

/**
 * Command-line interface for SuiWat.
 */
public final class Cli {

	private static final Logger LOG = SuiLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "suiwat.jar";
		}
		JAR_NAME = myName;
	}

	/** Program shown, with its compiled form, when no argument is given */
	static final String SAMPLE = "= g0 10\n+ g1 g0 5\n. g1\n";

	private final SuiSettings settings = new SuiSettings();
	private final PrintStream out;

	private ScriptFileSource scriptSource;
	private boolean printUsage;
	private boolean printSample;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the module text and messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link SuiSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public SuiSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program to compile, or {@code null} if none was given
	 */
	public ScriptFileSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			printSample = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one source file can be compiled at a time: " + arg);
				}
				scriptSource = new ScriptFileSource(arg);
			} else if (arg.equals("-o")) {
				// -o filename : output file
				checkParameterHasArgument(args, argIdx);
				settings.setOutputFile(args[++argIdx]);
			} else if (arg.equals("--wasm")) {
				// --wasm : produce a binary module
				settings.setOutputFormat(OutputFormat.WASM);
			} else if (arg.equals("--wat2wasm")) {
				// --wat2wasm command : assembler to use
				checkParameterHasArgument(args, argIdx);
				settings.setAssemblerCommand(args[++argIdx]);
			} else if (arg.equals("--strict")) {
				settings.setStrict(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			throw new IllegalArgumentException("Sui source file not provided.");
		}
		try {
			scriptSource.getReader();
		} catch (UncheckedIOException ex) {
			throw new IllegalArgumentException(
					"Failed to read source '" + scriptSource.getDescription() + "': " + ex.getCause().getMessage(),
					ex);
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the source cannot be read or the output cannot be
	 *         written
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			if (printSample) {
				sample(out);
			}
			return;
		}

		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings for {}:\n{}", scriptSource.getDescription(), settings.toDescriptionString());
		}
		SuiWat suiWat = new SuiWat(settings);
		String outputFile = settings.getOutputFile();
		if (settings.getOutputFormat() == OutputFormat.WASM) {
			byte[] wasm = suiWat.compileToWasm(scriptSource);
			if (outputFile == null) {
				outputFile = defaultWasmFile(scriptSource.getFilePath());
			}
			Files.write(Paths.get(outputFile), wasm);
			LOG.info("Wrote {} bytes to {}", wasm.length, outputFile);
			out.println("Compiled to " + outputFile + " (" + wasm.length + " bytes)");
		} else {
			String wat = suiWat.compile(scriptSource);
			if (outputFile == null) {
				out.println(wat);
			} else {
				Files.write(Paths.get(outputFile), (wat + "\n").getBytes(StandardCharsets.UTF_8));
				LOG.info("Wrote module text to {}", outputFile);
				out.println("Output saved to " + outputFile);
			}
		}
	}

	/**
	 * @param inputFile path of the source
	 * @return the path with its extension replaced by {@code .wasm}
	 */
	static String defaultWasmFile(String inputFile) {
		int dot = inputFile.lastIndexOf('.');
		int separator = Math.max(inputFile.lastIndexOf('/'), inputFile.lastIndexOf(File.separatorChar));
		String base = dot > separator ? inputFile.substring(0, dot) : inputFile;
		return base + ".wasm";
	}

	private static void usage(PrintStream dest) {
		dest.println("Sui to WebAssembly Text Format compiler");
		dest.println();
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-o output-filename]" +
								" [--wasm]" +
								" [--wat2wasm command]" +
								" [--strict]" +
								" source-filename");
		dest.println();
		dest.println(" -o filename = Write the result to filename instead of stdout (WAT) or <source>.wasm (--wasm).");
		dest.println(" --wasm = Produce a binary module, through wat2wasm.");
		dest.println(" --wat2wasm command = Assembler to use for --wasm (default: wat2wasm, from wabt).");
		dest.println(" --strict = Fail on values that cannot be resolved and on jumps to undefined labels.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	private static void sample(PrintStream dest) {
		dest.println();
		dest.println("Sample:");
		dest.println("Sui:");
		dest.print(SAMPLE);
		dest.println();
		dest.println("WAT:");
		dest.println(new SuiWat().compile(SAMPLE));
	}

	/**
	 * Parses the arguments, runs the CLI, and reports failures on the error
	 * stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for the module text and messages
	 * @param err stream for error messages
	 * @return the process exit code
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (SuiException e) {
			if (e.getLineNumber() >= 0) {
				err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return 1;
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.println(e.getMessage());
			return 1;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int exitCode = execute(args, System.out, System.err);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}
}
