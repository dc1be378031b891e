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

import java.io.IOException;
import java.io.LineNumberReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.suiwat.util.ScriptSource;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Turns a Sui source into a tree of {@link SourceBlock}s.
 * <p>
 * A line whose opcode is {@value #FUNCTION_BEGIN} opens a function
 * definition ({@code # <id> <argc>}) and the matching {@value #FUNCTION_END}
 * closes it. Definitions may be nested; each one becomes a child of the block
 * it appears in. Every other line belongs to the innermost open block.
 */
public class SuiParser {

	private static final Logger LOG = SuiLogger.getLogger(SuiParser.class);

	/** Opcode opening a function definition */
	public static final String FUNCTION_BEGIN = "#";

	/** Opcode closing a function definition */
	public static final String FUNCTION_END = "}";

	private final SuiTokenizer tokenizer = new SuiTokenizer();

	/**
	 * Reads and parses a whole source.
	 *
	 * @param source the Sui program
	 * @return the root block of the program
	 * @throws IOException when the source cannot be read
	 */
	public SourceBlock parse(ScriptSource source) throws IOException {
		List<TokenLine> lines = new ArrayList<TokenLine>();
		LineNumberReader reader = new LineNumberReader(source.getReader());
		String line;
		while ((line = reader.readLine()) != null) {
			lines.add(tokenizer.tokenize(line, reader.getLineNumber()));
		}
		return parse(lines, source.getDescription());
	}

	/**
	 * Parses already tokenized lines.
	 *
	 * @param lines lines of the program, blank ones included or not
	 * @param description name of the source, for error messages
	 * @return the root block of the program
	 */
	public SourceBlock parse(List<TokenLine> lines, String description) {
		SourceBlock root = SourceBlock.root();
		Deque<SourceBlock> open = new ArrayDeque<SourceBlock>();
		open.push(root);
		Map<Integer, SourceBlock> definitions = new HashMap<Integer, SourceBlock>();

		for (TokenLine line : lines) {
			if (line.isEmpty()) {
				continue;
			}
			if (line.isUnterminated()) {
				List<String> tokens = line.getTokens();
				throw new LexerException(
						"Unterminated string: " + tokens.get(tokens.size() - 1),
						description,
						line.getLineNumber());
			}
			String opcode = line.getOpcode();
			if (FUNCTION_BEGIN.equals(opcode)) {
				SourceBlock function = functionHeader(line, description);
				SourceBlock previous = definitions.putIfAbsent(function.getFunctionId(), function);
				if (previous != null) {
					throw new ParserException(
							"Function " + function.getFunctionId() + " is already defined at line " + previous.getLineNumber(),
							description,
							line.getLineNumber());
				}
				open.peek().addChild(function);
				open.push(function);
			} else if (FUNCTION_END.equals(opcode)) {
				if (open.size() == 1) {
					throw new ParserException("Unexpected " + FUNCTION_END + " outside of a function", description, line.getLineNumber());
				}
				open.pop();
			} else {
				open.peek().addLine(line);
			}
		}

		if (open.size() > 1) {
			SourceBlock unclosed = open.peek();
			throw new ParserException(
					"Function " + unclosed.getFunctionId() + " is never closed with " + FUNCTION_END,
					description,
					unclosed.getLineNumber());
		}

		LOG.debug("{}: {} entry lines, {} functions", description, root.getLines().size(), definitions.size());
		return root;
	}

	private static SourceBlock functionHeader(TokenLine line, String description) {
		List<String> operands = line.getOperands();
		if (operands.size() != 2) {
			throw new ParserException(
					"Function header must be '" + FUNCTION_BEGIN + " <id> <argc>', found: " + String.join(" ", line.getTokens()),
					description,
					line.getLineNumber());
		}
		int id = nonNegative(operands.get(0), "function id", line, description);
		int argc = nonNegative(operands.get(1), "parameter count", line, description);
		return SourceBlock.function(id, argc, line.getLineNumber());
	}

	private static int nonNegative(String token, String what, TokenLine line, String description) {
		int value;
		try {
			value = Integer.parseInt(token);
		} catch (NumberFormatException e) {
			value = -1;
		}
		if (value < 0) {
			throw new ParserException("Invalid " + what + ": " + token, description, line.getLineNumber());
		}
		return value;
	}
}
