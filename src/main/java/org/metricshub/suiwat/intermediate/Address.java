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
 * A jump target within one body: the label written in the source, and the
 * dispatch state that the label starts.
 * <p>
 * An address does not have a state assigned upon creation: states are
 * numbered once every label of the body is known, in ascending label order.
 * However, by the time code is emitted, all addresses must have one.
 */
public class Address {

	private final int lbl;
	private int idx = -1;

	public Address(int lbl) {
		this.lbl = lbl;
	}

	/**
	 * @return the label value, as written after {@code :}
	 */
	public int label() {
		return lbl;
	}

	/**
	 * Set the dispatch state of this address.
	 *
	 * @param index state id, 1 for the smallest label
	 */
	public void assignIndex(int index) {
		this.idx = index;
	}

	/**
	 * @return the dispatch state id, or {@code -1} if not assigned yet
	 */
	public int index() {
		return idx;
	}

	@Override
	public String toString() {
		return lbl + "->" + idx;
	}
}
