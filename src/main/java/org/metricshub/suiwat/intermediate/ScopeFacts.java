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

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What one scope (a function body, the entry routine, or the whole program)
 * refers to: global indices, local indices, and whether it needs linear
 * memory. Produced by {@link UsageCollector}, never modified afterwards.
 */
public final class ScopeFacts {

	/** Facts of a scope that refers to nothing */
	public static final ScopeFacts EMPTY = new ScopeFacts(new TreeSet<Integer>(), new TreeSet<Integer>(), false);

	private final SortedSet<Integer> globals;
	private final SortedSet<Integer> locals;
	private final boolean memoryRequired;

	ScopeFacts(SortedSet<Integer> globals, SortedSet<Integer> locals, boolean memoryRequired) {
		this.globals = Collections.unmodifiableSortedSet(new TreeSet<Integer>(globals));
		this.locals = Collections.unmodifiableSortedSet(new TreeSet<Integer>(locals));
		this.memoryRequired = memoryRequired;
	}

	/**
	 * @return indices of the referenced {@code g<n>} variables, ascending
	 */
	public SortedSet<Integer> getGlobals() {
		return globals;
	}

	/**
	 * @return indices of the referenced {@code v<n>} variables, ascending
	 */
	public SortedSet<Integer> getLocals() {
		return locals;
	}

	/**
	 * @return {@code true} if an array opcode appears in the scope
	 */
	public boolean isMemoryRequired() {
		return memoryRequired;
	}

	/**
	 * @param other facts of another scope
	 * @return the facts of both scopes together
	 */
	public ScopeFacts merge(ScopeFacts other) {
		SortedSet<Integer> g = new TreeSet<Integer>(globals);
		g.addAll(other.globals);
		SortedSet<Integer> l = new TreeSet<Integer>(locals);
		l.addAll(other.locals);
		return new ScopeFacts(g, l, memoryRequired || other.memoryRequired);
	}

	@Override
	public String toString() {
		return "globals=" + globals + ", locals=" + locals + ", memory=" + memoryRequired;
	}
}
