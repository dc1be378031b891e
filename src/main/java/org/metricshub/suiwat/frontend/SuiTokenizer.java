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
import java.util.List;

/**
 * Splits one Sui source line into tokens.
 * <p>
 * Tokens are separated by runs of spaces and tabs. A {@code ;} outside of a
 * string starts a comment that runs to the end of the line. A double-quoted
 * string, quotes included, is a single token; inside it, a backslash escapes
 * the next character.
 * <p>
 * The tokenizer never fails: a string left open swallows the rest of the line
 * and the returned {@link TokenLine} is flagged as unterminated, for the
 * caller to decide.
 */
public class SuiTokenizer {

	/** Start of an end-of-line comment */
	public static final char COMMENT = ';';

	private static final char QUOTE = '"';
	private static final char ESCAPE = '\\';

	/**
	 * Tokenizes a single line.
	 *
	 * @param line raw source line, without its line terminator
	 * @param lineNumber 1-based line number, kept for error reporting
	 * @return the tokens, possibly none
	 */
	public TokenLine tokenize(String line, int lineNumber) {
		List<String> tokens = new ArrayList<String>();
		boolean unterminated = false;
		int length = line.length();
		int i = 0;
		while (i < length) {
			char c = line.charAt(i);
			if (c == COMMENT) {
				break;
			}
			if (isWhitespace(c)) {
				i++;
				continue;
			}
			if (c == QUOTE) {
				int end = closingQuote(line, i + 1);
				if (end < 0) {
					tokens.add(line.substring(i));
					unterminated = true;
					break;
				}
				tokens.add(line.substring(i, end + 1));
				i = end + 1;
				continue;
			}
			int j = i;
			while (j < length && !isWhitespace(line.charAt(j)) && line.charAt(j) != COMMENT) {
				j++;
			}
			tokens.add(line.substring(i, j));
			i = j;
		}
		return new TokenLine(tokens, lineNumber, unterminated);
	}

	/**
	 * @return the index of the quote closing the string that starts before
	 *         {@code from}, or {@code -1} if the line ends first
	 */
	private static int closingQuote(String line, int from) {
		int j = from;
		while (j < line.length()) {
			char c = line.charAt(j);
			if (c == ESCAPE) {
				j += 2;
			} else if (c == QUOTE) {
				return j;
			} else {
				j++;
			}
		}
		return -1;
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\f';
	}
}
