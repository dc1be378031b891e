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

import java.util.HashMap;
import java.util.Map;

/**
 * Sui opcodes. Each one is written as a single symbol at the start of a line
 * and takes a fixed number of operands, except {@link #CALL} which takes at
 * least two.
 */
public enum Opcode {

	/**
	 * Assignment.
	 * <p>
	 * Syntax: {@code = dest value}
	 */
	ASSIGN("=", 2),

	/**
	 * Syntax: {@code + dest a b}
	 */
	ADD("+", 3, "i32.add"),

	/**
	 * Syntax: {@code - dest a b}
	 */
	SUBTRACT("-", 3, "i32.sub"),

	/**
	 * Syntax: {@code * dest a b}
	 */
	MULTIPLY("*", 3, "i32.mul"),

	/**
	 * Signed division.
	 * <p>
	 * Syntax: {@code / dest a b}
	 */
	DIVIDE("/", 3, "i32.div_s"),

	/**
	 * Signed remainder.
	 * <p>
	 * Syntax: {@code % dest a b}
	 */
	MOD("%", 3, "i32.rem_s"),

	/**
	 * {@code dest = a < b ? 1 : 0}
	 * <p>
	 * Syntax: {@code < dest a b}
	 */
	CMP_LT("<", 3, "i32.lt_s"),

	/**
	 * {@code dest = a > b ? 1 : 0}
	 * <p>
	 * Syntax: {@code > dest a b}
	 */
	CMP_GT(">", 3, "i32.gt_s"),

	/**
	 * {@code dest = a == b ? 1 : 0}
	 * <p>
	 * Syntax: {@code ~ dest a b}
	 */
	CMP_EQ("~", 3, "i32.eq"),

	/**
	 * {@code dest = a == 0 ? 1 : 0}
	 * <p>
	 * Syntax: {@code ! dest a}
	 */
	NOT("!", 2, "i32.eqz"),

	/**
	 * Bitwise and.
	 * <p>
	 * Syntax: {@code & dest a b}
	 */
	AND("&", 3, "i32.and"),

	/**
	 * Bitwise or.
	 * <p>
	 * Syntax: {@code | dest a b}
	 */
	OR("|", 3, "i32.or"),

	/**
	 * Prints a value through the host.
	 * <p>
	 * Syntax: {@code . value}
	 */
	PRINT(".", 1),

	/**
	 * Allocates {@code size} integers on the heap.
	 * <p>
	 * Syntax: {@code [ dest size}
	 */
	ARRAY_NEW("[", 2),

	/**
	 * {@code dest = array[index]}
	 * <p>
	 * Syntax: {@code ] dest array index}
	 */
	ARRAY_GET("]", 3),

	/**
	 * {@code array[index] = value}
	 * <p>
	 * Syntax: <code>{ array index value</code>
	 */
	ARRAY_SET("{", 3),

	/**
	 * Syntax: {@code $ dest function-id arg...}
	 */
	CALL("$", 2),

	/**
	 * Syntax: {@code ^ value}
	 */
	RETURN("^", 1),

	/**
	 * Syntax: {@code @ label}
	 */
	JUMP("@", 1),

	/**
	 * Jumps when the condition is not zero.
	 * <p>
	 * Syntax: {@code ? condition label}
	 */
	JUMP_IF("?", 2),

	/**
	 * Syntax: {@code : label}
	 */
	LABEL(":", 1);

	private static final Map<String, Opcode> BY_SYMBOL = new HashMap<String, Opcode>();

	static {
		for (Opcode opcode : values()) {
			BY_SYMBOL.put(opcode.symbol, opcode);
		}
	}

	private final String symbol;
	private final int operandCount;
	private final String watInstruction;

	Opcode(String symbol, int operandCount) {
		this(symbol, operandCount, null);
	}

	Opcode(String symbol, int operandCount, String watInstruction) {
		this.symbol = symbol;
		this.operandCount = operandCount;
		this.watInstruction = watInstruction;
	}

	/**
	 * @param symbol first token of a source line
	 * @return the opcode, or {@code null} if the symbol is unknown
	 */
	public static Opcode fromSymbol(String symbol) {
		return BY_SYMBOL.get(symbol);
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * @return the number of operands, the minimum for {@link #CALL}
	 */
	public int operandCount() {
		return operandCount;
	}

	/**
	 * @return {@code true} when the opcode accepts more operands than
	 *         {@link #operandCount()}
	 */
	public boolean isVariadic() {
		return this == CALL;
	}

	/**
	 * @return the i32 instruction computing the result of an arithmetic,
	 *         comparison or bitwise opcode, {@code null} for the others
	 */
	public String watInstruction() {
		return watInstruction;
	}

	/**
	 * @return {@code true} for the array opcodes, which need linear memory
	 */
	public boolean usesMemory() {
		return this == ARRAY_NEW || this == ARRAY_GET || this == ARRAY_SET;
	}
}
