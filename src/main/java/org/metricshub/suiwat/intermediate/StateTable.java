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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Maps the labels of one body to dispatch states. State {@value #ENTRY_STATE}
 * is the code before the first label; the labels, sorted by value, get states
 * 1, 2, 3... regardless of where they appear in the body.
 */
public final class StateTable {

	private static final Logger LOG = SuiLogger.getLogger(StateTable.class);

	/** State of the instructions that precede the first label */
	public static final int ENTRY_STATE = 0;

	private final SortedMap<Integer, Address> addresses;
	private final FallbackPolicy unknownLabelPolicy;

	private StateTable(SortedMap<Integer, Address> addresses, FallbackPolicy unknownLabelPolicy) {
		this.addresses = Collections.unmodifiableSortedMap(addresses);
		this.unknownLabelPolicy = unknownLabelPolicy;
	}

	/**
	 * Collects the label markers of a body and numbers them.
	 *
	 * @param body decoded instructions of one function or of the entry routine
	 * @param unknownLabelPolicy what {@link #resolve(int, int)} does with
	 *        labels that are not in the body
	 * @return the table, empty if the body has no label
	 */
	public static StateTable build(List<Instruction> body, FallbackPolicy unknownLabelPolicy) {
		SortedMap<Integer, Address> addresses = new TreeMap<Integer, Address>();
		for (Instruction insn : body) {
			if (insn instanceof Instruction.LabelMarker) {
				int label = ((Instruction.LabelMarker) insn).getLabel();
				addresses.putIfAbsent(label, new Address(label));
			}
		}
		int state = ENTRY_STATE;
		for (Address address : addresses.values()) {
			address.assignIndex(++state);
		}
		if (!addresses.isEmpty()) {
			LOG.debug("Dispatch states: {}", addresses.values());
		}
		return new StateTable(addresses, unknownLabelPolicy);
	}

	/**
	 * @return {@code true} if the body has no label, and needs no dispatch loop
	 */
	public boolean isEmpty() {
		return addresses.isEmpty();
	}

	/**
	 * @return number of states, the entry state included
	 */
	public int getStateCount() {
		return addresses.size() + 1;
	}

	/**
	 * @return the addresses, ascending by label and therefore by state
	 */
	public Collection<Address> getAddresses() {
		return addresses.values();
	}

	/**
	 * @param label a label value
	 * @return the state the label starts, or {@code -1} if it is not defined
	 */
	public int stateOf(int label) {
		Address address = addresses.get(label);
		return address == null ? -1 : address.index();
	}

	/**
	 * Resolves the target of a jump.
	 *
	 * @param label target label
	 * @param lineNumber line of the jump, for diagnostics
	 * @return the target state; {@link #ENTRY_STATE} for an undefined label
	 *         under the lenient policy
	 * @throws SuiException of kind {@link ErrorKind#UNKNOWN_JUMP_TARGET} for an
	 *         undefined label under the strict policy
	 */
	public int resolve(int label, int lineNumber) {
		int state = stateOf(label);
		if (state >= 0) {
			return state;
		}
		if (unknownLabelPolicy == FallbackPolicy.STRICT) {
			throw new SuiException(ErrorKind.UNKNOWN_JUMP_TARGET, lineNumber, "Jump to undefined label " + label);
		}
		LOG.warn("Line {}: jump to undefined label {}, using the entry state instead", lineNumber, label);
		return ENTRY_STATE;
	}

	public FallbackPolicy getUnknownLabelPolicy() {
		return unknownLabelPolicy;
	}
}
