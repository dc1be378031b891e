package org.metricshub.suiwat.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.SuiException;
import org.metricshub.suiwat.intermediate.Instruction;
import org.metricshub.suiwat.intermediate.Opcode;
import org.metricshub.suiwat.intermediate.Value;
import org.metricshub.suiwat.util.FallbackPolicy;

public class InstructionDecoderTest {

	private static final InstructionDecoder LENIENT = new InstructionDecoder("test", FallbackPolicy.LENIENT);
	private static final InstructionDecoder STRICT = new InstructionDecoder("test", FallbackPolicy.STRICT);

	private static Instruction decode(String... tokens) {
		return LENIENT.decode(TokenLine.of(1, tokens));
	}

	@Test
	public void testOperandKinds() {
		Instruction.Binary add = (Instruction.Binary) decode("+", "v3", "g1", "a0");
		assertEquals(Opcode.ADD, add.getOpcode());
		assertEquals(Value.local(3), add.getDest());
		assertEquals(Value.global(1), add.getLeft());
		assertEquals(Value.param(0), add.getRight());

		Instruction.Assign assign = (Instruction.Assign) decode("=", "v0", "-42");
		assertEquals(Value.integer(-42), assign.getValue());

		assign = (Instruction.Assign) decode("=", "v0", "2.5");
		assertEquals(Value.Kind.FLOAT, assign.getValue().getKind());
		assertEquals(2.5, assign.getValue().getFloatValue(), 0.0);

		assign = (Instruction.Assign) decode("=", "v0", "\"text\"");
		assertEquals(Value.Kind.STRING, assign.getValue().getKind());
		assertEquals("\"text\"", assign.getValue().getText());
	}

	@Test
	public void testUnresolvedValueIsZeroWhenLenient() {
		Instruction.Assign assign = (Instruction.Assign) decode("=", "g0", "foo");
		assertEquals(Value.ZERO, assign.getValue());
		assign = (Instruction.Assign) decode("=", "g0", "vx");
		assertEquals("Sigil without index", Value.ZERO, assign.getValue());
	}

	@Test
	public void testUnresolvedValueFailsWhenStrict() {
		SuiException e = assertThrows(
				"Unresolvable operand must fail in strict mode",
				SuiException.class,
				() -> STRICT.decode(TokenLine.of(5, ".", "foo")));
		assertEquals(ErrorKind.UNRESOLVED_VALUE, e.getKind());
		assertEquals(5, e.getLineNumber());
	}

	@Test
	public void testCallArguments() {
		Instruction.Call call = (Instruction.Call) decode("$", "v0", "7", "1", "g2");
		assertEquals(7, call.getFunctionId());
		assertEquals(Arrays.asList(Value.integer(1), Value.global(2)), call.getArguments());
		call = (Instruction.Call) decode("$", "v0", "7");
		assertTrue(call.getArguments().isEmpty());
	}

	@Test
	public void testControlFlow() {
		assertEquals(4, ((Instruction.Jump) decode("@", "4")).getLabel());
		Instruction.JumpIf jumpIf = (Instruction.JumpIf) decode("?", "v1", "9");
		assertEquals(Value.local(1), jumpIf.getCondition());
		assertEquals(9, jumpIf.getLabel());
		assertEquals(2, ((Instruction.LabelMarker) decode(":", "2")).getLabel());
		assertTrue(decode("^", "0").isTerminator());
		assertTrue(decode("@", "0").isTerminator());
		assertFalse("A conditional jump may fall through", decode("?", "v0", "0").isTerminator());
	}

	@Test
	public void testArrayOpcodes() {
		Instruction.ArrayNew alloc = (Instruction.ArrayNew) decode("[", "v0", "3");
		assertEquals(Value.integer(3), alloc.getSize());
		Instruction.ArrayGet get = (Instruction.ArrayGet) decode("]", "v1", "v0", "2");
		assertEquals(Value.local(0), get.getArray());
		assertEquals(Value.integer(2), get.getIndex());
		Instruction.ArraySet set = (Instruction.ArraySet) decode("{", "v0", "1", "g0");
		assertEquals(Value.global(0), set.getValue());
	}

	@Test
	public void testMalformedLines() {
		assertThrows("Unknown opcode", ParserException.class, () -> decode("x", "v0"));
		assertThrows("Missing operand", ParserException.class, () -> decode("+", "v0", "1"));
		assertThrows("Extra operand", ParserException.class, () -> decode(".", "1", "2"));
		assertThrows("Call without function id", ParserException.class, () -> decode("$", "v0"));
		assertThrows("Literal destination", ParserException.class, () -> decode("=", "5", "1"));
		assertThrows("Negative label", ParserException.class, () -> decode("@", "-1"));
		assertThrows("Label is not a number", ParserException.class, () -> decode(":", "v1"));
	}

	@Test
	public void testDuplicateLabelInBody() {
		List<TokenLine> lines = Arrays.asList(
				TokenLine.of(1, ":", "1"),
				TokenLine.of(2, ".", "1"),
				TokenLine.of(3, ":", "1"));
		ParserException e = assertThrows(
				"Label defined twice must fail",
				ParserException.class,
				() -> LENIENT.decodeBody(lines));
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testSameLabelInDifferentBodies() {
		List<TokenLine> lines = Arrays.asList(TokenLine.of(1, ":", "1"), TokenLine.of(2, "@", "1"));
		assertEquals(2, LENIENT.decodeBody(lines).size());
		assertEquals(2, LENIENT.decodeBody(lines).size());
	}
}
