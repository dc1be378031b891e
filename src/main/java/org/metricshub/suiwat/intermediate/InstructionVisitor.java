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

/**
 * One method per kind of {@link Instruction}. Adding a kind of instruction
 * breaks every visitor until it handles it.
 *
 * @param <R> result of a visit
 */
public interface InstructionVisitor<R> {

	R visitAssign(Instruction.Assign insn);

	R visitBinary(Instruction.Binary insn);

	R visitNot(Instruction.Not insn);

	R visitPrint(Instruction.Print insn);

	R visitArrayNew(Instruction.ArrayNew insn);

	R visitArrayGet(Instruction.ArrayGet insn);

	R visitArraySet(Instruction.ArraySet insn);

	R visitCall(Instruction.Call insn);

	R visitReturn(Instruction.Return insn);

	R visitJump(Instruction.Jump insn);

	R visitJumpIf(Instruction.JumpIf insn);

	R visitLabel(Instruction.LabelMarker insn);
}
