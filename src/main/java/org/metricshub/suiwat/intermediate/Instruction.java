package org.metricshub.suiwat.intermediate;

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
import java.util.Collections;
import java.util.List;

/**
 * One decoded Sui instruction. The set of subclasses is closed: they are all
 * nested here, and code that needs to tell them apart goes through an
 * {@link InstructionVisitor}.
 */
public abstract class Instruction {

	private final Opcode opcode;
	private final int lineNumber;

	private Instruction(Opcode opcode, int lineNumber) {
		this.opcode = opcode;
		this.lineNumber = lineNumber;
	}

	public Opcode getOpcode() {
		return opcode;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return {@code true} if control never falls through to the next
	 *         instruction
	 */
	public boolean isTerminator() {
		return false;
	}

	public abstract <R> R accept(InstructionVisitor<R> visitor);

	@Override
	public String toString() {
		return opcode.symbol() + " " + operandsToString();
	}

	abstract String operandsToString();

	/**
	 * {@code dest = value}
	 */
	public static final class Assign extends Instruction {
		private final Value dest;
		private final Value value;

		public Assign(int lineNumber, Value dest, Value value) {
			super(Opcode.ASSIGN, lineNumber);
			this.dest = dest;
			this.value = value;
		}

		public Value getDest() {
			return dest;
		}

		public Value getValue() {
			return value;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitAssign(this);
		}

		@Override
		String operandsToString() {
			return dest + " " + value;
		}
	}

	/**
	 * {@code dest = left <op> right}, for every opcode that has a
	 * {@link Opcode#watInstruction()} taking two operands.
	 */
	public static final class Binary extends Instruction {
		private final Value dest;
		private final Value left;
		private final Value right;

		public Binary(Opcode opcode, int lineNumber, Value dest, Value left, Value right) {
			super(opcode, lineNumber);
			if (opcode.watInstruction() == null || opcode.operandCount() != 3) {
				throw new IllegalArgumentException(opcode + " is not a binary operator");
			}
			this.dest = dest;
			this.left = left;
			this.right = right;
		}

		public Value getDest() {
			return dest;
		}

		public Value getLeft() {
			return left;
		}

		public Value getRight() {
			return right;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		String operandsToString() {
			return dest + " " + left + " " + right;
		}
	}

	/**
	 * {@code dest = operand == 0 ? 1 : 0}
	 */
	public static final class Not extends Instruction {
		private final Value dest;
		private final Value operand;

		public Not(int lineNumber, Value dest, Value operand) {
			super(Opcode.NOT, lineNumber);
			this.dest = dest;
			this.operand = operand;
		}

		public Value getDest() {
			return dest;
		}

		public Value getOperand() {
			return operand;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitNot(this);
		}

		@Override
		String operandsToString() {
			return dest + " " + operand;
		}
	}

	public static final class Print extends Instruction {
		private final Value value;

		public Print(int lineNumber, Value value) {
			super(Opcode.PRINT, lineNumber);
			this.value = value;
		}

		public Value getValue() {
			return value;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitPrint(this);
		}

		@Override
		String operandsToString() {
			return value.toString();
		}
	}

	/**
	 * {@code dest = heap_ptr; heap_ptr += size * 4}
	 */
	public static final class ArrayNew extends Instruction {
		private final Value dest;
		private final Value size;

		public ArrayNew(int lineNumber, Value dest, Value size) {
			super(Opcode.ARRAY_NEW, lineNumber);
			this.dest = dest;
			this.size = size;
		}

		public Value getDest() {
			return dest;
		}

		public Value getSize() {
			return size;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitArrayNew(this);
		}

		@Override
		String operandsToString() {
			return dest + " " + size;
		}
	}

	public static final class ArrayGet extends Instruction {
		private final Value dest;
		private final Value array;
		private final Value index;

		public ArrayGet(int lineNumber, Value dest, Value array, Value index) {
			super(Opcode.ARRAY_GET, lineNumber);
			this.dest = dest;
			this.array = array;
			this.index = index;
		}

		public Value getDest() {
			return dest;
		}

		public Value getArray() {
			return array;
		}

		public Value getIndex() {
			return index;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitArrayGet(this);
		}

		@Override
		String operandsToString() {
			return dest + " " + array + " " + index;
		}
	}

	public static final class ArraySet extends Instruction {
		private final Value array;
		private final Value index;
		private final Value value;

		public ArraySet(int lineNumber, Value array, Value index, Value value) {
			super(Opcode.ARRAY_SET, lineNumber);
			this.array = array;
			this.index = index;
			this.value = value;
		}

		public Value getArray() {
			return array;
		}

		public Value getIndex() {
			return index;
		}

		public Value getValue() {
			return value;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitArraySet(this);
		}

		@Override
		String operandsToString() {
			return array + " " + index + " " + value;
		}
	}

	public static final class Call extends Instruction {
		private final Value dest;
		private final int functionId;
		private final List<Value> arguments;

		public Call(int lineNumber, Value dest, int functionId, List<Value> arguments) {
			super(Opcode.CALL, lineNumber);
			this.dest = dest;
			this.functionId = functionId;
			this.arguments = Collections.unmodifiableList(new ArrayList<Value>(arguments));
		}

		public Value getDest() {
			return dest;
		}

		public int getFunctionId() {
			return functionId;
		}

		public List<Value> getArguments() {
			return arguments;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitCall(this);
		}

		@Override
		String operandsToString() {
			StringBuilder sb = new StringBuilder();
			sb.append(dest).append(' ').append(functionId);
			for (Value argument : arguments) {
				sb.append(' ').append(argument);
			}
			return sb.toString();
		}
	}

	public static final class Return extends Instruction {
		private final Value value;

		public Return(int lineNumber, Value value) {
			super(Opcode.RETURN, lineNumber);
			this.value = value;
		}

		public Value getValue() {
			return value;
		}

		@Override
		public boolean isTerminator() {
			return true;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitReturn(this);
		}

		@Override
		String operandsToString() {
			return value.toString();
		}
	}

	public static final class Jump extends Instruction {
		private final int label;

		public Jump(int lineNumber, int label) {
			super(Opcode.JUMP, lineNumber);
			this.label = label;
		}

		public int getLabel() {
			return label;
		}

		@Override
		public boolean isTerminator() {
			return true;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitJump(this);
		}

		@Override
		String operandsToString() {
			return Integer.toString(label);
		}
	}

	/**
	 * Jumps to {@code label} when {@code condition} is not zero, falls through
	 * otherwise.
	 */
	public static final class JumpIf extends Instruction {
		private final Value condition;
		private final int label;

		public JumpIf(int lineNumber, Value condition, int label) {
			super(Opcode.JUMP_IF, lineNumber);
			this.condition = condition;
			this.label = label;
		}

		public Value getCondition() {
			return condition;
		}

		public int getLabel() {
			return label;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitJumpIf(this);
		}

		@Override
		String operandsToString() {
			return condition + " " + label;
		}
	}

	public static final class LabelMarker extends Instruction {
		private final int label;

		public LabelMarker(int lineNumber, int label) {
			super(Opcode.LABEL, lineNumber);
			this.label = label;
		}

		public int getLabel() {
			return label;
		}

		@Override
		public <R> R accept(InstructionVisitor<R> visitor) {
			return visitor.visitLabel(this);
		}

		@Override
		String operandsToString() {
			return Integer.toString(label);
		}
	}
}
