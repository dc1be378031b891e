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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.Opcode;
import org.metricshub.suiwat.intermediate.Value;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.SuiLogger;
import org.slf4j.Logger;

/**
 * Turns {@link TokenLine}s into {@link Instruction}s.
 * <p>
 * Operands that are neither a variable nor a literal are handled according
 * to the unresolved-value policy: compiled as the integer zero (with a
 * warning), or rejected.
 */
public class InstructionDecoder {

	private static final Logger LOG = SuiLogger.getLogger(InstructionDecoder.class);

	private final String description;
	private final FallbackPolicy unresolvedValuePolicy;

	/**
	 * @param description name of the source, for error messages
	 * @param unresolvedValuePolicy what to do with operands that cannot be
	 *        resolved
	 */
	public InstructionDecoder(String description, FallbackPolicy unresolvedValuePolicy) {
		this.description = description;
		this.unresolvedValuePolicy = unresolvedValuePolicy;
	}

	/**
	 * Decodes the lines of one body.
	 *
	 * @param lines lines of a function or of the entry routine
	 * @return the instructions, in source order
	 */
	public List<Instruction> decodeBody(List<TokenLine> lines) {
		List<Instruction> body = new ArrayList<Instruction>();
		Map<Integer, Integer> labelLines = new HashMap<Integer, Integer>();
		for (TokenLine line : lines) {
			if (line.isEmpty()) {
				continue;
			}
			Instruction insn = decode(line);
			if (insn instanceof Instruction.LabelMarker) {
				int label = ((Instruction.LabelMarker) insn).getLabel();
				Integer previous = labelLines.putIfAbsent(label, line.getLineNumber());
				if (previous != null) {
					throw new ParserException(
							"Label " + label + " is already defined at line " + previous,
							description,
							line.getLineNumber());
				}
			}
			body.add(insn);
		}
		return body;
	}

	/**
	 * Decodes one line.
	 *
	 * @param line a non-empty line
	 * @return the instruction
	 */
	public Instruction decode(TokenLine line) {
		Opcode opcode = Opcode.fromSymbol(line.getOpcode());
		if (opcode == null) {
			throw parserException("Unknown opcode: " + line.getOpcode(), line);
		}
		List<String> ops = line.getOperands();
		if (ops.size() < opcode.operandCount() || (!opcode.isVariadic() && ops.size() > opcode.operandCount())) {
			throw parserException(
					opcode.symbol() + " expects " + (opcode.isVariadic() ? "at least " : "") + opcode.operandCount()
							+ " operands, found " + ops.size(),
					line);
		}
		int lineno = line.getLineNumber();
		switch (opcode) {
		case ASSIGN:
			return new Instruction.Assign(lineno, dest(ops.get(0), line), value(ops.get(1), line));
		case ADD:
		case SUBTRACT:
		case MULTIPLY:
		case DIVIDE:
		case MOD:
		case CMP_LT:
		case CMP_GT:
		case CMP_EQ:
		case AND:
		case OR:
			return new Instruction.Binary(
					opcode,
					lineno,
					dest(ops.get(0), line),
					value(ops.get(1), line),
					value(ops.get(2), line));
		case NOT:
			return new Instruction.Not(lineno, dest(ops.get(0), line), value(ops.get(1), line));
		case PRINT:
			return new Instruction.Print(lineno, value(ops.get(0), line));
		case ARRAY_NEW:
			return new Instruction.ArrayNew(lineno, dest(ops.get(0), line), value(ops.get(1), line));
		case ARRAY_GET:
			return new Instruction.ArrayGet(
					lineno,
					dest(ops.get(0), line),
					value(ops.get(1), line),
					value(ops.get(2), line));
		case ARRAY_SET:
			return new Instruction.ArraySet(
					lineno,
					value(ops.get(0), line),
					value(ops.get(1), line),
					value(ops.get(2), line));
		case CALL:
			List<Value> args = new ArrayList<Value>();
			for (String arg : ops.subList(2, ops.size())) {
				args.add(value(arg, line));
			}
			return new Instruction.Call(lineno, dest(ops.get(0), line), number(ops.get(1), "function id", line), args);
		case RETURN:
			return new Instruction.Return(lineno, value(ops.get(0), line));
		case JUMP:
			return new Instruction.Jump(lineno, number(ops.get(0), "label", line));
		case JUMP_IF:
			return new Instruction.JumpIf(lineno, value(ops.get(0), line), number(ops.get(1), "label", line));
		case LABEL:
			return new Instruction.LabelMarker(lineno, number(ops.get(0), "label", line));
		default:
			throw new IllegalStateException("Unhandled opcode: " + opcode);
		}
	}

	private Value dest(String token, TokenLine line) {
		Value dest = Value.parse(token);
		if (dest == null || !dest.isVariable()) {
			throw parserException("Cannot assign to " + token + ", a variable is expected", line);
		}
		return dest;
	}

	private Value value(String token, TokenLine line) {
		Value value = Value.parse(token);
		if (value != null) {
			return value;
		}
		if (unresolvedValuePolicy == FallbackPolicy.STRICT) {
			throw new SuiException(
					ErrorKind.UNRESOLVED_VALUE,
					line.getLineNumber(),
					"Cannot resolve value " + token + " (" + description + ")");
		}
		LOG.warn("{} line {}: cannot resolve value {}, using 0 instead", description, line.getLineNumber(), token);
		return Value.ZERO;
	}

	private int number(String token, String what, TokenLine line) {
		int number = Value.parseIndex(token);
		if (number < 0) {
			throw parserException("Invalid " + what + ": " + token, line);
		}
		return number;
	}

	private ParserException parserException(String msg, TokenLine line) {
		return new ParserException(msg, description, line.getLineNumber());
	}
}
