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
 * A fatal compilation failure. It is provided to conveniently distinguish
 * SuiWat failures from other runtime exceptions, and tells the caller what
 * went wrong through its {@link ErrorKind}.
 */
public class SuiException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final int lineNumber;

	/**
	 * @param kind category of the failure
	 * @param msg description of the failure
	 */
	public SuiException(ErrorKind kind, String msg) {
		this(kind, -1, msg);
	}

	/**
	 * @param kind category of the failure
	 * @param msg description of the failure
	 * @param cause underlying cause
	 */
	public SuiException(ErrorKind kind, String msg, Throwable cause) {
		super(msg, cause);
		this.kind = kind;
		this.lineNumber = -1;
	}

	/**
	 * @param kind category of the failure
	 * @param lineno source line the failure relates to, or {@code -1}
	 * @param msg description of the failure
	 */
	public SuiException(ErrorKind kind, int lineno, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	/**
	 * @return the category of this failure
	 */
	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
