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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Where an operand comes from: a local variable ({@code v<n>}), a global
 * variable ({@code g<n>}), a function parameter ({@code a<n>}), or an
 * integer, floating point or string literal.
 * <p>
 * Variable indices are the ones written in the source; they are never
 * renumbered.
 */
public final class Value {

	/**
	 * Storage class of a value.
	 */
	public enum Kind {
		LOCAL('v'),
		GLOBAL('g'),
		PARAM('a'),
		INT,
		FLOAT,
		STRING;

		private final char sigil;

		Kind() {
			this('\0');
		}

		Kind(char sigil) {
			this.sigil = sigil;
		}

		/**
		 * @return the leading character of a variable of this kind, or
		 *         {@code '\0'} for literals
		 */
		public char sigil() {
			return sigil;
		}
	}

	private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
	private static final Pattern FLOAT = Pattern.compile("[+-]?([0-9]+\\.[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

	/** The integer zero, which also stands in for literals that cannot be resolved */
	public static final Value ZERO = integer(0);

	private final Kind kind;
	private final int number;
	private final double floatValue;
	private final String text;

	private Value(Kind kind, int number, double floatValue, String text) {
		this.kind = kind;
		this.number = number;
		this.floatValue = floatValue;
		this.text = text;
	}

	public static Value local(int index) {
		return new Value(Kind.LOCAL, index, 0, null);
	}

	public static Value global(int index) {
		return new Value(Kind.GLOBAL, index, 0, null);
	}

	public static Value param(int index) {
		return new Value(Kind.PARAM, index, 0, null);
	}

	public static Value integer(int value) {
		return new Value(Kind.INT, value, 0, null);
	}

	public static Value floating(double value) {
		return new Value(Kind.FLOAT, 0, value, null);
	}

	public static Value string(String literal) {
		return new Value(Kind.STRING, 0, 0, literal);
	}

	/**
	 * Decodes an operand token.
	 *
	 * @param token operand as written in the source
	 * @return the value, or {@code null} when the token is neither a
	 *         variable nor a literal
	 */
	public static Value parse(String token) {
		if (token.isEmpty()) {
			return null;
		}
		char first = token.charAt(0);
		if (first == '"') {
			return string(token);
		}
		for (Kind kind : new Kind[] { Kind.LOCAL, Kind.GLOBAL, Kind.PARAM }) {
			if (first == kind.sigil()) {
				int index = parseIndex(token.substring(1));
				return index < 0 ? null : new Value(kind, index, 0, null);
			}
		}
		if (FLOAT.matcher(token).matches()) {
			double d = Double.parseDouble(token);
			return Double.isInfinite(d) ? null : floating(d);
		}
		if (INTEGER.matcher(token).matches()) {
			try {
				return integer(Integer.parseInt(token));
			} catch (NumberFormatException e) {
				return null;
			}
		}
		return null;
	}

	/**
	 * Parses the index that follows a variable sigil.
	 *
	 * @param digits text after the sigil
	 * @return the index, or {@code -1} if {@code digits} is not a
	 *         non-negative integer
	 */
	public static int parseIndex(String digits) {
		if (digits.isEmpty()) {
			return -1;
		}
		for (int i = 0; i < digits.length(); i++) {
			char c = digits.charAt(i);
			if (c < '0' || c > '9') {
				return -1;
			}
		}
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			return -1;
		}
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return {@code true} for locals, globals and parameters
	 */
	public boolean isVariable() {
		return kind == Kind.LOCAL || kind == Kind.GLOBAL || kind == Kind.PARAM;
	}

	/**
	 * @return the variable index, or the value of an integer literal
	 */
	public int getNumber() {
		return number;
	}

	public double getFloatValue() {
		return floatValue;
	}

	/**
	 * @return the string literal, quotes included
	 */
	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Value)) {
			return false;
		}
		Value other = (Value) obj;
		return kind == other.kind
				&& number == other.number
				&& Double.compare(floatValue, other.floatValue) == 0
				&& Objects.equals(text, other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, number, floatValue, text);
	}

	@Override
	public String toString() {
		switch (kind) {
		case INT:
			return Integer.toString(number);
		case FLOAT:
			return Double.toString(floatValue);
		case STRING:
			return text;
		default:
			return kind.sigil() + Integer.toString(number);
		}
	}
}
