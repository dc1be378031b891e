package org.metricshub.suiwat.frontend;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import org.junit.Test;
import org.metricshub.suiwat.ErrorKind;
import org.metricshub.suiwat.util.ScriptSource;

public class SuiParserTest {

	private static SourceBlock parse(String... lines) throws IOException {
		String code = String.join("\n", lines) + "\n";
		return new SuiParser().parse(new ScriptSource("test.sui", new StringReader(code)));
	}

	@Test
	public void testEntryLinesOnly() throws Exception {
		SourceBlock root = parse("= g0 1", "", "; comment", ". g0");
		assertTrue(root.isRoot());
		assertEquals(2, root.getLines().size());
		assertEquals("Line numbers are kept", 4, root.getLines().get(1).getLineNumber());
		assertTrue(root.getFunctions().isEmpty());
	}

	@Test
	public void testFunctionsAreSeparatedFromEntryRoutine() throws Exception {
		SourceBlock root = parse(
				"# 1 2",
				"+ v0 a0 a1",
				"^ v0",
				"}",
				"$ g0 1 3 4");
		assertEquals(1, root.getLines().size());
		assertEquals("$", root.getLines().get(0).getOpcode());
		List<SourceBlock> functions = root.getFunctions();
		assertEquals(1, functions.size());
		SourceBlock f = functions.get(0);
		assertEquals(1, f.getFunctionId());
		assertEquals(2, f.getParamCount());
		assertEquals(1, f.getLineNumber());
		assertEquals(2, f.getLines().size());
	}

	@Test
	public void testNestedFunctionsAreChildren() throws Exception {
		SourceBlock root = parse(
				"# 1 0",
				"= v0 1",
				"# 2 0",
				"= v1 2",
				"^ v1",
				"}",
				"^ v0",
				"}",
				". g0");
		assertEquals(1, root.getChildren().size());
		SourceBlock outer = root.getChildren().get(0);
		assertEquals("Nested lines are not part of the outer body", 2, outer.getLines().size());
		assertEquals(1, outer.getChildren().size());
		assertEquals(2, outer.getChildren().get(0).getFunctionId());

		List<SourceBlock> functions = root.getFunctions();
		assertEquals(2, functions.size());
		assertEquals(1, functions.get(0).getFunctionId());
		assertEquals(2, functions.get(1).getFunctionId());
		assertEquals("All lines of the program", 5, root.getAllLines().size());
	}

	@Test
	public void testDuplicateFunctionId() {
		ParserException e = assertThrows(
				"Defining function 1 twice must fail",
				ParserException.class,
				() -> parse("# 1 0", "^ 0", "}", "# 1 1", "^ a0", "}"));
		assertEquals(4, e.getLineNumber());
		assertEquals(ErrorKind.MALFORMED_SOURCE, e.getKind());
		assertTrue(e.getMessage(), e.getMessage().contains("already defined at line 1"));
		assertEquals("test.sui", e.getSourceDescription());
	}

	@Test
	public void testStrayClosingBrace() {
		ParserException e = assertThrows(
				"A } without a function must fail",
				ParserException.class,
				() -> parse("= g0 1", "}"));
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testUnclosedFunctionIsReportedAtItsHeader() {
		ParserException e = assertThrows(
				"A function without } must fail",
				ParserException.class,
				() -> parse("= g0 1", "# 3 0", "^ 1"));
		assertEquals(2, e.getLineNumber());
		assertTrue(e.getMessage(), e.getMessage().contains("Function 3 is never closed"));
	}

	@Test
	public void testMalformedHeaders() {
		assertThrows("Missing argc", ParserException.class, () -> parse("# 1", "}"));
		assertThrows("Extra operand", ParserException.class, () -> parse("# 1 2 3", "}"));
		assertThrows("Negative id", ParserException.class, () -> parse("# -1 0", "}"));
		assertThrows("Non-numeric argc", ParserException.class, () -> parse("# 1 x", "}"));
	}

	@Test
	public void testUnterminatedStringIsLexerError() {
		LexerException e = assertThrows(
				"Unterminated string must fail",
				LexerException.class,
				() -> parse("= g0 1", ". \"oops"));
		assertEquals(2, e.getLineNumber());
		assertEquals(ErrorKind.MALFORMED_SOURCE, e.getKind());
	}
}
