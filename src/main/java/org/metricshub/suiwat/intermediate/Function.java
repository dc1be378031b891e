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
import java.util.List;

/**
 * A function definition: its id, the number of parameters it takes, its
 * decoded body and the facts of that body.
 */
public final class Function {

	private final int id;
	private final int paramCount;
	private final List<Instruction> body;
	private final ScopeFacts facts;

	public Function(int id, int paramCount, List<Instruction> body, ScopeFacts facts) {
		this.id = id;
		this.paramCount = paramCount;
		this.body = Collections.unmodifiableList(new ArrayList<Instruction>(body));
		this.facts = facts;
	}

	public int getId() {
		return id;
	}

	public int getParamCount() {
		return paramCount;
	}

	public List<Instruction> getBody() {
		return body;
	}

	public ScopeFacts getFacts() {
		return facts;
	}

	@Override
	public String toString() {
		return "f" + id + "/" + paramCount;
	}
}
