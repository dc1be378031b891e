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

import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.InstructionVisitor;
import org.metricshub.suiwat.intermediate.StateTable;
import org.metricshub.suiwat.intermediate.Value;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Emits the stack-machine code of single instructions. All values are i32;
 * {@code v<n>} and {@code a<n>} are locals of the function, {@code g<n>}
 * module globals.
 * <p>
 * Jumps are compiled against a {@link StateTable}. When the table is empty
 * the body is emitted without a dispatch loop, and a jump, having nowhere to
 * go, returns 0 from the function.
 */
public class InstructionEncoder implements InstructionVisitor<Void> {

	private static final Logger LOG = SuiLogger.getLogger(InstructionEncoder.class);

	/** Host function printing an i32 */
	public static final String PRINT_FUNCTION = "$print_i32";

	/** Bump allocator pointer */
	public static final String HEAP_POINTER = "$heap_ptr";

	/** Width in bytes of an array element */
	public static final int ELEMENT_SIZE = 4;

	private final WatBuilder out;
	private final StateTable states;

	/**
	 * @param out where the code goes
	 * @param states states of the body being compiled
	 */
	public InstructionEncoder(WatBuilder out, StateTable states) {
		this.out = out;
		this.states = states;
	}

	static String localName(int index) {
		return "$v" + index;
	}

	static String globalName(int index) {
		return "$g" + index;
	}

	static String paramName(int index) {
		return "$a" + index;
	}

	static String functionName(int id) {
		return "$f" + id;
	}

	/**
	 * Pushes a value on the stack.
	 *
	 * @param value the operand
	 */
	void push(Value value) {
		switch (value.getKind()) {
		case LOCAL:
			out.line("(local.get " + localName(value.getNumber()) + ")");
			break;
		case GLOBAL:
			out.line("(global.get " + globalName(value.getNumber()) + ")");
			break;
		case PARAM:
			out.line("(local.get " + paramName(value.getNumber()) + ")");
			break;
		case INT:
			out.line("(i32.const " + value.getNumber() + ")");
			break;
		case FLOAT:
			out.line("(f64.const " + value.getFloatValue() + ")");
			out.line("(i32.trunc_f64_s)");
			break;
		case STRING:
			// no string data in memory yet
			out.line("(i32.const 0)");
			break;
		default:
			throw new IllegalStateException("Unhandled value kind: " + value.getKind());
		}
	}

	/**
	 * Pops the top of the stack into a variable.
	 *
	 * @param dest a local, global or parameter
	 */
	void store(Value dest) {
		switch (dest.getKind()) {
		case LOCAL:
			out.line("(local.set " + localName(dest.getNumber()) + ")");
			break;
		case GLOBAL:
			out.line("(global.set " + globalName(dest.getNumber()) + ")");
			break;
		case PARAM:
			out.line("(local.set " + paramName(dest.getNumber()) + ")");
			break;
		default:
			throw new IllegalArgumentException("Cannot store into " + dest);
		}
	}

	private void elementAddress(Value array, Value index) {
		push(array);
		push(index);
		out.line("(i32.const " + ELEMENT_SIZE + ")");
		out.line("(i32.mul)");
		out.line("(i32.add)");
	}

	void gotoState(int state) {
		out.line("(i32.const " + state + ")");
		out.line("(local.set " + ControlFlowReconstructor.STATE_LOCAL + ")");
		out.line("(br " + ControlFlowReconstructor.DISPATCH_LABEL + ")");
	}

	private void returnZero() {
		out.line("(i32.const 0)");
		out.line("(return)");
	}

	/**
	 * Jump in a body without labels: no target can exist.
	 */
	private void checkJumpWithoutLabels(int label, int lineNumber) {
		if (states.getUnknownLabelPolicy() == FallbackPolicy.STRICT) {
			throw new SuiException(ErrorKind.UNKNOWN_JUMP_TARGET, lineNumber, "Jump to undefined label " + label);
		}
		LOG.warn("Line {}: jump to label {} in a body without labels, compiled as a return of 0", lineNumber, label);
	}

	@Override
	public Void visitAssign(Instruction.Assign insn) {
		push(insn.getValue());
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitBinary(Instruction.Binary insn) {
		push(insn.getLeft());
		push(insn.getRight());
		out.line("(" + insn.getOpcode().watInstruction() + ")");
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitNot(Instruction.Not insn) {
		push(insn.getOperand());
		out.line("(" + insn.getOpcode().watInstruction() + ")");
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitPrint(Instruction.Print insn) {
		push(insn.getValue());
		out.line("(call " + PRINT_FUNCTION + ")");
		return null;
	}

	@Override
	public Void visitArrayNew(Instruction.ArrayNew insn) {
		// the old pointer stays on the stack while the pointer is bumped
		out.line("(global.get " + HEAP_POINTER + ")");
		out.line("(global.get " + HEAP_POINTER + ")");
		push(insn.getSize());
		out.line("(i32.const " + ELEMENT_SIZE + ")");
		out.line("(i32.mul)");
		out.line("(i32.add)");
		out.line("(global.set " + HEAP_POINTER + ")");
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitArrayGet(Instruction.ArrayGet insn) {
		elementAddress(insn.getArray(), insn.getIndex());
		out.line("(i32.load)");
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitArraySet(Instruction.ArraySet insn) {
		elementAddress(insn.getArray(), insn.getIndex());
		push(insn.getValue());
		out.line("(i32.store)");
		return null;
	}

	@Override
	public Void visitCall(Instruction.Call insn) {
		for (Value arg : insn.getArguments()) {
			push(arg);
		}
		out.line("(call " + functionName(insn.getFunctionId()) + ")");
		store(insn.getDest());
		return null;
	}

	@Override
	public Void visitReturn(Instruction.Return insn) {
		push(insn.getValue());
		out.line("(return)");
		return null;
	}

	@Override
	public Void visitJump(Instruction.Jump insn) {
		if (states.isEmpty()) {
			checkJumpWithoutLabels(insn.getLabel(), insn.getLineNumber());
			returnZero();
		} else {
			gotoState(states.resolve(insn.getLabel(), insn.getLineNumber()));
		}
		return null;
	}

	@Override
	public Void visitJumpIf(Instruction.JumpIf insn) {
		int target = -1;
		if (states.isEmpty()) {
			checkJumpWithoutLabels(insn.getLabel(), insn.getLineNumber());
		} else {
			target = states.resolve(insn.getLabel(), insn.getLineNumber());
		}
		push(insn.getCondition());
		out.open("(if");
		out.open("(then");
		if (target < 0) {
			returnZero();
		} else {
			gotoState(target);
		}
		out.close();
		out.close();
		return null;
	}

	@Override
	public Void visitLabel(Instruction.LabelMarker insn) {
		// structural only, the dispatch loop starts a new state here
		return null;
	}
}
