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

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.suiwat.backend.ControlFlowReconstructor;
import org.metricshub.suiwat.backend.ModuleAssembler;
import org.metricshub.suiwat.backend.Wat2WasmAssembler;
import org.metricshub.suiwat.backend.WasmAssembler;
import org.metricshub.suiwat.frontend.InstructionDecoder;
import org.metricshub.suiwat.frontend.SourceBlock;
import org.metricshub.suiwat.frontend.SuiParser;
import org.metricshub.suiwat.intermediate.Function;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.ScopeFacts;
import org.metricshub.suiwat.intermediate.SuiModule;
import org.metricshub.suiwat.intermediate.UsageCollector;
import org.metricshub.suiwat.util.ScriptSource;
import org.metricshub.suiwat.util.SuiLogger;
import org.metricshub.suiwat.util.SuiSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, analysis and compilation of a Sui program.
 * This entry point is used both when SuiWat is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to compile a Sui program is as follows:
 * <ul>
 * <li>Tokenize every line and build the tree of function definitions.
 * <li>Collect the variables and memory use of every scope, and decode the
 * instructions of every function and of the entry routine.
 * <li>Emit each body, through a dispatch loop when it has labels, and
 * assemble the module text.
 * <li>Optionally, hand the text over to an external assembler to get a
 * binary module.
 * </ul>
 * An instance only holds its settings, and can compile any number of
 * programs.
 */
public class SuiWat {

	private static final Logger LOG = SuiLogger.getLogger(SuiWat.class);

	private final SuiSettings settings;

	private final WasmAssembler wasmAssembler;

	/**
	 * Create a new instance with default settings.
	 */
	public SuiWat() {
		this(new SuiSettings());
	}

	/**
	 * @param settings fallback policies and assembler command
	 */
	public SuiWat(SuiSettings settings) {
		this(settings, new Wat2WasmAssembler(settings.getAssemblerCommand()));
	}

	/**
	 * @param settings fallback policies
	 * @param wasmAssembler what turns module text into a binary module
	 */
	public SuiWat(SuiSettings settings, WasmAssembler wasmAssembler) {
		this.settings = settings;
		this.wasmAssembler = wasmAssembler;
	}

	public SuiSettings getSettings() {
		return settings;
	}

	/**
	 * Parses and decodes a program without emitting any code.
	 *
	 * @param source the program
	 * @return the decoded module
	 * @throws IOException if the source cannot be read
	 */
	public SuiModule parse(ScriptSource source) throws IOException {
		SourceBlock root = new SuiParser().parse(source);
		return buildModule(root, source.getDescription());
	}

	private SuiModule buildModule(SourceBlock root, String description) {
		InstructionDecoder decoder = new InstructionDecoder(description, settings.getUnresolvedValuePolicy());

		List<Function> functions = new ArrayList<Function>();
		for (SourceBlock block : root.getFunctions()) {
			List<Instruction> body = decoder.decodeBody(block.getLines());
			functions.add(new Function(block.getFunctionId(), block.getParamCount(), body, UsageCollector.collect(block.getLines())));
		}
		List<Instruction> entryBody = decoder.decodeBody(root.getLines());
		ScopeFacts entryFacts = UsageCollector.collect(root.getLines());
		ScopeFacts programFacts = UsageCollector.collect(root.getAllLines());

		LOG.debug("{}: {}", description, programFacts);
		return new SuiModule(programFacts, functions, entryBody, entryFacts);
	}

	/**
	 * Compiles a program to WebAssembly text.
	 *
	 * @param source the program
	 * @return the module text
	 * @throws IOException if the source cannot be read
	 */
	public String compile(ScriptSource source) throws IOException {
		SuiModule module = parse(source);
		ModuleAssembler assembler = new ModuleAssembler(new ControlFlowReconstructor(settings.getUnknownLabelPolicy()));
		return assembler.assemble(module);
	}

	/**
	 * Compiles program text to WebAssembly text.
	 *
	 * @param code the program
	 * @return the module text
	 */
	public String compile(String code) {
		try {
			return compile(inline(code));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Compiles a program to a binary module, through the external assembler.
	 *
	 * @param source the program
	 * @return the binary module
	 * @throws IOException if the source cannot be read
	 */
	public byte[] compileToWasm(ScriptSource source) throws IOException {
		return wasmAssembler.assemble(compile(source));
	}

	/**
	 * Compiles program text to a binary module, through the external
	 * assembler.
	 *
	 * @param code the program
	 * @return the binary module
	 */
	public byte[] compileToWasm(String code) {
		return wasmAssembler.assemble(compile(code));
	}

	private static ScriptSource inline(String code) {
		return new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(code));
	}
}
