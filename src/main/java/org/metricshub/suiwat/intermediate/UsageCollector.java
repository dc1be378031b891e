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

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.metricshub.suiwat.frontend.TokenLine;

/**
 * Finds out which variables and features a scope uses, by looking at its
 * tokens only. Operands that start with a variable sigil but are not followed
 * by a valid index are ignored here; decoding deals with them.
 */
public final class UsageCollector {

	private UsageCollector() {}

	/**
	 * @param lines token lines of one scope, in any order
	 * @return the globals, locals and memory use of the scope
	 */
	public static ScopeFacts collect(List<TokenLine> lines) {
		SortedSet<Integer> globals = new TreeSet<Integer>();
		SortedSet<Integer> locals = new TreeSet<Integer>();
		boolean memoryRequired = false;
		for (TokenLine line : lines) {
			if (line.isEmpty()) {
				continue;
			}
			Opcode opcode = Opcode.fromSymbol(line.getOpcode());
			if (opcode != null && opcode.usesMemory()) {
				memoryRequired = true;
			}
			for (String operand : line.getOperands()) {
				if (operand.isEmpty()) {
					continue;
				}
				char sigil = operand.charAt(0);
				if (sigil == Value.Kind.GLOBAL.sigil()) {
					addIndex(globals, operand);
				} else if (sigil == Value.Kind.LOCAL.sigil()) {
					addIndex(locals, operand);
				}
			}
		}
		return new ScopeFacts(globals, locals, memoryRequired);
	}

	private static void addIndex(SortedSet<Integer> target, String operand) {
		int index = Value.parseIndex(operand.substring(1));
		if (index >= 0) {
			target.add(index);
		}
	}
}
