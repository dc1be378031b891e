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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the block tree built by {@link SuiParser}: either the root of the
 * program, whose lines form the entry routine, or one function definition.
 * Function definitions nested in a block are its children, not part of its
 * lines.
 */
public final class SourceBlock {

	private final int functionId;
	private final int paramCount;
	private final int lineNumber;
	private final List<TokenLine> lines = new ArrayList<TokenLine>();
	private final List<SourceBlock> children = new ArrayList<SourceBlock>();

	private SourceBlock(int functionId, int paramCount, int lineNumber) {
		this.functionId = functionId;
		this.paramCount = paramCount;
		this.lineNumber = lineNumber;
	}

	static SourceBlock root() {
		return new SourceBlock(-1, 0, 0);
	}

	static SourceBlock function(int functionId, int paramCount, int lineNumber) {
		return new SourceBlock(functionId, paramCount, lineNumber);
	}

	void addLine(TokenLine line) {
		lines.add(line);
	}

	void addChild(SourceBlock child) {
		children.add(child);
	}

	public boolean isRoot() {
		return functionId < 0;
	}

	/**
	 * @return the function id, or {@code -1} for the root block
	 */
	public int getFunctionId() {
		return functionId;
	}

	public int getParamCount() {
		return paramCount;
	}

	/**
	 * @return line of the function header, {@code 0} for the root block
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the lines of this block, in source order, without the lines of
	 *         nested function definitions
	 */
	public List<TokenLine> getLines() {
		return Collections.unmodifiableList(lines);
	}

	public List<SourceBlock> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * @return every function definition below this block, depth first, in
	 *         source order
	 */
	public List<SourceBlock> getFunctions() {
		List<SourceBlock> result = new ArrayList<SourceBlock>();
		collectFunctions(result);
		return result;
	}

	private void collectFunctions(List<SourceBlock> result) {
		for (SourceBlock child : children) {
			result.add(child);
			child.collectFunctions(result);
		}
	}

	/**
	 * @return the lines of this block and of all nested blocks
	 */
	public List<TokenLine> getAllLines() {
		List<TokenLine> result = new ArrayList<TokenLine>(lines);
		for (SourceBlock function : getFunctions()) {
			result.addAll(function.lines);
		}
		return result;
	}
}
