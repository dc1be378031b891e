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

/**
 * Classifies the failures a compilation can end with. Every
 * {@link SuiException} carries exactly one kind, so that callers can react to
 * a failure without parsing its message.
 */
public enum ErrorKind {

	/**
	 * The source could not be decoded: unterminated string, unbalanced
	 * function nesting, duplicate function id or label, unknown opcode,
	 * missing operands, and so on.
	 */
	MALFORMED_SOURCE,

	/**
	 * An operand is neither a variable, a parameter nor a numeric or string
	 * literal, and the unresolved-value policy is strict.
	 */
	UNRESOLVED_VALUE,

	/**
	 * A jump targets a label that is not defined in its body, and the
	 * unknown-label policy is strict.
	 */
	UNKNOWN_JUMP_TARGET,

	/**
	 * The external assembler ran but rejected the module.
	 */
	ASSEMBLER_FAILED,

	/**
	 * The external assembler could not be started.
	 */
	ASSEMBLER_NOT_INSTALLED
}
