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

import java.util.List;
import org.metricshub.suiwat.intermediate.Function;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.ScopeFacts;
import org.metricshub.suiwat.intermediate.StateTable;
import org.metricshub.suiwat.intermediate.SuiModule;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Emits the WebAssembly text of a {@link SuiModule}, in this order:
 * <ol>
 * <li>the import of the host print function;
 * <li>linear memory and the heap pointer, if an array opcode is used;
 * <li>one exported mutable global per referenced {@code g<n>};
 * <li>the functions, ascending by id;
 * <li>the exported {@code main} function, running the entry routine.
 * </ol>
 * Every collection is emitted in sorted order, so the same module always gives
 * the same text.
 */
public class ModuleAssembler {

	private static final Logger LOG = SuiLogger.getLogger(ModuleAssembler.class);

	/** Export name of the entry routine */
	public static final String ENTRY_EXPORT = "main";

	private final ControlFlowReconstructor reconstructor;

	public ModuleAssembler(ControlFlowReconstructor reconstructor) {
		this.reconstructor = reconstructor;
	}

	/**
	 * @param module the program
	 * @return the module text, without a trailing newline
	 */
	public String assemble(SuiModule module) {
		WatBuilder out = new WatBuilder();
		ScopeFacts program = module.getProgramFacts();

		out.open("(module");

		out.line(";; External function imports");
		out.line("(import \"env\" \"print_i32\" (func " + InstructionEncoder.PRINT_FUNCTION + " (param i32)))");
		out.blank();

		if (program.isMemoryRequired()) {
			out.line(";; Linear memory and heap pointer");
			out.line("(memory (export \"memory\") 1)");
			out.line("(global " + InstructionEncoder.HEAP_POINTER + " (mut i32) (i32.const 0))");
			out.blank();
		}

		if (!program.getGlobals().isEmpty()) {
			out.line(";; Global variables");
			for (int g : program.getGlobals()) {
				out.line("(global " + InstructionEncoder.globalName(g) + " (export \"g" + g + "\") (mut i32) (i32.const 0))");
			}
			out.blank();
		}

		if (!module.getFunctions().isEmpty()) {
			out.line(";; Function definitions");
			for (Function function : module.getFunctions()) {
				StringBuilder header = new StringBuilder("(func ").append(InstructionEncoder.functionName(function.getId()));
				for (int a = 0; a < function.getParamCount(); a++) {
					header.append(" (param ").append(InstructionEncoder.paramName(a)).append(" i32)");
				}
				header.append(" (result i32)");
				out.open(header.toString());
				body(function.getBody(), function.getFacts(), out);
				out.close();
				out.blank();
			}
		}

		out.line(";; Main function");
		out.open("(func $main (export \"" + ENTRY_EXPORT + "\") (result i32)");
		body(module.getEntryBody(), module.getEntryFacts(), out);
		out.close();

		out.close();

		LOG.debug("Assembled {} functions, {} globals, memory: {}",
				module.getFunctions().size(), program.getGlobals().size(), program.isMemoryRequired());
		return out.build();
	}

	/**
	 * Local declarations, code, and the default result of a function.
	 */
	private void body(List<Instruction> instructions, ScopeFacts facts, WatBuilder out) {
		StateTable states = reconstructor.analyze(instructions);
		for (int v : facts.getLocals()) {
			out.line("(local " + InstructionEncoder.localName(v) + " i32)");
		}
		if (!states.isEmpty()) {
			out.line("(local " + ControlFlowReconstructor.STATE_LOCAL + " i32)");
		}
		reconstructor.compile(instructions, states, out);
		out.line("(i32.const 0)");
	}
}
