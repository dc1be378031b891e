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

/**
 * Converts WebAssembly text into a binary module. Implemented outside of the
 * compiler, typically by an external tool.
 */
public interface WasmAssembler {

	/**
	 * @param wat text of one module
	 * @return the binary module
	 * @throws org.metricshub.suiwat.SuiException of kind
	 *         {@link org.metricshub.suiwat.ErrorKind#ASSEMBLER_FAILED} or
	 *         {@link org.metricshub.suiwat.ErrorKind#ASSEMBLER_NOT_INSTALLED}
	 */
	byte[] assemble(String wat);
}
