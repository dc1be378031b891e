package org.metricshub.suiwat.util;

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
 * A simple container for the parameters of a single SuiWat invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking SuiWat programmatically, from within Java code.
 */
public class SuiSettings {

	/**
	 * Kind of file produced by the command line.
	 */
	public enum OutputFormat {
		/** WebAssembly text format. */
		WAT,
		/** Binary module, through the external assembler. */
		WASM
	}

	/**
	 * What to do with operands that are neither variables nor literals;
	 * <code>LENIENT</code> (compile them as zero) by default.
	 */
	private FallbackPolicy unresolvedValuePolicy = FallbackPolicy.LENIENT;

	/**
	 * What to do with jumps to labels that are not defined in their body;
	 * <code>LENIENT</code> (jump to the entry state) by default.
	 */
	private FallbackPolicy unknownLabelPolicy = FallbackPolicy.LENIENT;

	/**
	 * Command used to assemble WAT into a binary module;
	 * <code>wat2wasm</code> by default, looked up in the PATH.
	 */
	private String assemblerCommand = "wat2wasm";

	/**
	 * Where to write the result.
	 * <code>null</code> means standard output for WAT, and
	 * a file derived from the input name for binary modules.
	 */
	private String outputFile = null;

	/**
	 * What to produce; <code>WAT</code> by default.
	 */
	private OutputFormat outputFormat = OutputFormat.WAT;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("unresolvedValuePolicy = ").append(getUnresolvedValuePolicy()).append(newLine);
		desc.append("unknownLabelPolicy = ").append(getUnknownLabelPolicy()).append(newLine);
		desc.append("assemblerCommand = ").append(getAssemblerCommand()).append(newLine);
		desc.append("outputFile = ").append(getOutputFile()).append(newLine);
		desc.append("outputFormat = ").append(getOutputFormat()).append(newLine);

		return desc.toString();
	}

	public FallbackPolicy getUnresolvedValuePolicy() {
		return unresolvedValuePolicy;
	}

	public void setUnresolvedValuePolicy(FallbackPolicy unresolvedValuePolicy) {
		this.unresolvedValuePolicy = unresolvedValuePolicy;
	}

	public FallbackPolicy getUnknownLabelPolicy() {
		return unknownLabelPolicy;
	}

	public void setUnknownLabelPolicy(FallbackPolicy unknownLabelPolicy) {
		this.unknownLabelPolicy = unknownLabelPolicy;
	}

	/**
	 * Switches both fallback policies at once.
	 *
	 * @param strict {@code true} to fail on unresolved values and unknown
	 *        labels, {@code false} to substitute defaults
	 */
	public void setStrict(boolean strict) {
		FallbackPolicy policy = strict ? FallbackPolicy.STRICT : FallbackPolicy.LENIENT;
		setUnresolvedValuePolicy(policy);
		setUnknownLabelPolicy(policy);
	}

	public String getAssemblerCommand() {
		return assemblerCommand;
	}

	public void setAssemblerCommand(String assemblerCommand) {
		this.assemblerCommand = assemblerCommand;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public OutputFormat getOutputFormat() {
		return outputFormat;
	}

	public void setOutputFormat(OutputFormat outputFormat) {
		this.outputFormat = outputFormat;
	}
}
