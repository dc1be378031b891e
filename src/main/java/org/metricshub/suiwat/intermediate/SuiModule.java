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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Everything the assembler needs to emit one WebAssembly module: the facts of
 * the whole program, the functions sorted by id, and the entry routine.
 * Built once per compilation and not modified afterwards.
 */
public final class SuiModule {

	private final ScopeFacts programFacts;
	private final List<Function> functions;
	private final List<Instruction> entryBody;
	private final ScopeFacts entryFacts;

	/**
	 * @param programFacts facts of all scopes together; its globals and
	 *        memory flag are the module's
	 * @param functions function definitions, in any order
	 * @param entryBody instructions outside of any function
	 * @param entryFacts facts of the entry routine alone
	 */
	public SuiModule(ScopeFacts programFacts, List<Function> functions, List<Instruction> entryBody, ScopeFacts entryFacts) {
		this.programFacts = programFacts;
		List<Function> sorted = new ArrayList<Function>(functions);
		sorted.sort(Comparator.comparingInt(Function::getId));
		this.functions = Collections.unmodifiableList(sorted);
		this.entryBody = Collections.unmodifiableList(new ArrayList<Instruction>(entryBody));
		this.entryFacts = entryFacts;
	}

	public ScopeFacts getProgramFacts() {
		return programFacts;
	}

	/**
	 * @return the functions, ascending by id
	 */
	public List<Function> getFunctions() {
		return functions;
	}

	public List<Instruction> getEntryBody() {
		return entryBody;
	}

	public ScopeFacts getEntryFacts() {
		return entryFacts;
	}
}
