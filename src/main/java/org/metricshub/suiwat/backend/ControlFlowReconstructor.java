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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.StateTable;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Compiles a body that may contain labels and jumps into structured code.
 * <p>
 * A body without labels is emitted instruction by instruction. Otherwise the
 * body is cut into states, one per label plus the entry state, and emitted as
 * a single dispatch loop:
 *
 * <pre>
 * (block $exit
 *   (loop $dispatch
 *     (if (i32.eq (local.get $state) (i32.const 0))
 *       (then ...state 0..., then set $state to 1 and br $dispatch))
 *     (if (i32.eq (local.get $state) (i32.const 1))
 *       (then ...state 1..., then br $exit))))
 * </pre>
 *
 * A jump sets {@code $state} to the state of its label and restarts the loop,
 * which lets any jump graph, irreducible ones included, be expressed with one
 * loop and one level of conditionals.
 */
public class ControlFlowReconstructor {

	private static final Logger LOG = SuiLogger.getLogger(ControlFlowReconstructor.class);

	/** Local holding the current dispatch state */
	public static final String STATE_LOCAL = "$state";

	/** Label of the block that ends the body */
	public static final String EXIT_LABEL = "$exit";

	/** Label of the dispatch loop */
	public static final String DISPATCH_LABEL = "$dispatch";

	private final FallbackPolicy unknownLabelPolicy;

	/**
	 * @param unknownLabelPolicy what to do with jumps to undefined labels
	 */
	public ControlFlowReconstructor(FallbackPolicy unknownLabelPolicy) {
		this.unknownLabelPolicy = unknownLabelPolicy;
	}

	/**
	 * @param body instructions of a function or of the entry routine
	 * @return the states of the body; empty when no dispatch loop is needed
	 */
	public StateTable analyze(List<Instruction> body) {
		return StateTable.build(body, unknownLabelPolicy);
	}

	/**
	 * Splits a body into its states. Each instruction goes to the state of the
	 * last label seen before it, or to the entry state. Label markers
	 * themselves are dropped.
	 *
	 * @param body instructions of the body
	 * @param states the states of the body, from {@link #analyze(List)}
	 * @return the instructions of each state, indexed by state id
	 */
	public static List<List<Instruction>> partition(List<Instruction> body, StateTable states) {
		List<List<Instruction>> result = new ArrayList<List<Instruction>>();
		for (int i = 0; i < states.getStateCount(); i++) {
			result.add(new ArrayList<Instruction>());
		}
		int current = StateTable.ENTRY_STATE;
		for (Instruction insn : body) {
			if (insn instanceof Instruction.LabelMarker) {
				current = states.stateOf(((Instruction.LabelMarker) insn).getLabel());
			} else {
				result.get(current).add(insn);
			}
		}
		return result;
	}

	/**
	 * Emits the code of a body.
	 *
	 * @param body instructions of the body
	 * @param states the states of the body, from {@link #analyze(List)}
	 * @param out where the code goes; {@link #STATE_LOCAL} must already be
	 *        declared if {@code states} is not empty
	 */
	public void compile(List<Instruction> body, StateTable states, WatBuilder out) {
		InstructionEncoder encoder = new InstructionEncoder(out, states);
		if (states.isEmpty()) {
			for (Instruction insn : body) {
				insn.accept(encoder);
			}
			return;
		}

		List<List<Instruction>> partitions = partition(body, states);
		LOG.debug("Reconstructing {} instructions as {} states", body.size(), partitions.size());

		out.open("(block " + EXIT_LABEL);
		out.open("(loop " + DISPATCH_LABEL);
		for (int state = 0; state < partitions.size(); state++) {
			List<Instruction> instructions = partitions.get(state);
			out.open("(if (i32.eq (local.get " + STATE_LOCAL + ") (i32.const " + state + "))");
			out.open("(then");
			for (Instruction insn : instructions) {
				insn.accept(encoder);
			}
			if (!endsWithTerminator(instructions)) {
				if (state + 1 < partitions.size()) {
					encoder.gotoState(state + 1);
				} else {
					out.line("(br " + EXIT_LABEL + ")");
				}
			}
			out.close();
			out.close();
		}
		out.close();
		out.close();
	}

	private static boolean endsWithTerminator(List<Instruction> instructions) {
		return !instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator();
	}
}
