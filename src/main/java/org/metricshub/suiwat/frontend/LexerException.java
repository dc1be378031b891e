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

import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;

/**
 * A source line could not be split into tokens.
 */
public class LexerException extends SuiException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the source being compiled
	 * @param lineNumber offending line
	 */
	public LexerException(String msg, String sourceDescription, int lineNumber) {
		super(ErrorKind.MALFORMED_SOURCE, lineNumber, msg + " (" + sourceDescription + ")");
		this.sourceDescription = sourceDescription;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
