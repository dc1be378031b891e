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
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the lines of WebAssembly text, indenting them by two spaces per
 * open s-expression. One builder is created per module and passed along to
 * whatever emits code into it.
 */
public final class WatBuilder {

	private static final String INDENT = "  ";

	private final List<String> lines = new ArrayList<String>();
	private int indent;

	/**
	 * Emits one line at the current indentation.
	 *
	 * @param text the line, without indentation
	 * @return this builder
	 */
	public WatBuilder line(String text) {
		lines.add(INDENT.repeat(indent) + text);
		return this;
	}

	/**
	 * Emits a line that opens an s-expression; following lines are indented
	 * one level deeper until {@link #close()}.
	 *
	 * @param text the opening line, starting with {@code (}
	 * @return this builder
	 */
	public WatBuilder open(String text) {
		line(text);
		indent++;
		return this;
	}

	/**
	 * Closes the innermost s-expression opened with {@link #open(String)}.
	 *
	 * @return this builder
	 */
	public WatBuilder close() {
		if (indent == 0) {
			throw new IllegalStateException("No open s-expression to close");
		}
		indent--;
		return line(")");
	}

	/**
	 * Emits an empty line, without indentation.
	 *
	 * @return this builder
	 */
	public WatBuilder blank() {
		lines.add("");
		return this;
	}

	public int getIndent() {
		return indent;
	}

	public List<String> getLines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return the lines joined with {@code \n}, without a trailing newline
	 */
	public String build() {
		if (indent != 0) {
			throw new IllegalStateException(indent + " s-expressions are still open");
		}
		return String.join("\n", lines);
	}
}
