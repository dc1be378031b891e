package org.metricshub.suiwat.backend;

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
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Runs {@code wat2wasm} from the WebAssembly Binary Toolkit (wabt) on a
 * temporary copy of the module, and reads back the binary it produces.
 */
public class Wat2WasmAssembler implements WasmAssembler {

	private static final Logger LOG = SuiLogger.getLogger(Wat2WasmAssembler.class);

	/** Remediation shown when the assembler cannot be started */
	public static final String INSTALL_HINT = "Install wabt (e.g. \"brew install wabt\" or \"apt install wabt\")";

	private final String command;

	/**
	 * @param command name or path of the {@code wat2wasm} executable
	 */
	public Wat2WasmAssembler(String command) {
		this.command = command;
	}

	public String getCommand() {
		return command;
	}

	@Override
	public byte[] assemble(String wat) {
		Path workDir = null;
		try {
			workDir = Files.createTempDirectory("suiwat");
			Path watFile = workDir.resolve("module.wat");
			Path wasmFile = workDir.resolve("module.wasm");
			Files.write(watFile, wat.getBytes(StandardCharsets.UTF_8));

			Process process = start(watFile, wasmFile);
			String diagnostics;
			try (InputStream in = process.getInputStream()) {
				diagnostics = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
			}
			int exitCode = process.waitFor();
			if (exitCode != 0) {
				throw new SuiException(
						ErrorKind.ASSEMBLER_FAILED,
						command + " failed with exit code " + exitCode + ": " + diagnostics);
			}
			byte[] wasm = Files.readAllBytes(wasmFile);
			LOG.debug("{} produced {} bytes", command, wasm.length);
			return wasm;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SuiException(ErrorKind.ASSEMBLER_FAILED, "Interrupted while waiting for " + command, e);
		} catch (IOException e) {
			throw new SuiException(ErrorKind.ASSEMBLER_FAILED, "I/O error while running " + command + ": " + e.getMessage(), e);
		} finally {
			if (workDir != null) {
				deleteRecursively(workDir);
			}
		}
	}

	private Process start(Path watFile, Path wasmFile) {
		ProcessBuilder pb = new ProcessBuilder(command, watFile.toString(), "-o", wasmFile.toString());
		pb.redirectErrorStream(true);
		try {
			return pb.start();
		} catch (IOException e) {
			throw new SuiException(
					ErrorKind.ASSEMBLER_NOT_INSTALLED,
					"Cannot run " + command + " (" + e.getMessage() + "). " + INSTALL_HINT,
					e);
		}
	}

	@SuppressFBWarnings(value = "RV_RETURN_VALUE_IGNORED_BAD_PRACTICE", justification = "temporary files, removal is best effort")
	private static void deleteRecursively(Path dir) {
		try (Stream<Path> paths = Files.walk(dir)) {
			paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
		} catch (IOException e) {
			LOG.warn("Could not delete temporary directory {}: {}", dir, e.getMessage());
		}
	}
}
