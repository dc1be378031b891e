package org.metricshub.suiwat.frontend;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The tokens of one source line. The first token is the opcode, the others
 * are its operands.
 */
public final class TokenLine {

	private final List<String> tokens;
	private final int lineNumber;
	private final boolean unterminated;

	TokenLine(List<String> tokens, int lineNumber, boolean unterminated) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.lineNumber = lineNumber;
		this.unterminated = unterminated;
	}

	/**
	 * Builds a line from already split tokens.
	 *
	 * @param lineNumber line number in the source, 1-based
	 * @param tokens opcode followed by operands
	 * @return the new line
	 */
	public static TokenLine of(int lineNumber, String... tokens) {
		return new TokenLine(Arrays.asList(tokens), lineNumber, false);
	}

	public List<String> getTokens() {
		return tokens;
	}

	/**
	 * @return {@code true} for a blank or comment-only line
	 */
	public boolean isEmpty() {
		return tokens.isEmpty();
	}

	public String getOpcode() {
		return tokens.get(0);
	}

	/**
	 * @return the tokens after the opcode
	 */
	public List<String> getOperands() {
		return tokens.subList(1, tokens.size());
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return {@code true} when the last token is a string literal whose
	 *         closing quote is missing
	 */
	public boolean isUnterminated() {
		return unterminated;
	}

	@Override
	public String toString() {
		return lineNumber + ": " + String.join(" ", tokens);
	}
}
