package org.metricshub.suiwat.backend;

import static org.junit.Assert.*;

import org.junit.Test;

public class WatBuilderTest {

	@Test
	public void testIndentation() {
		WatBuilder out = new WatBuilder();
		out.open("(module").line(";; nothing").blank().open("(func $f").line("(i32.const 0)").close().close();
		assertEquals(0, out.getIndent());
		assertEquals("(module\n  ;; nothing\n\n  (func $f\n    (i32.const 0)\n  )\n)", out.build());
	}

	@Test
	public void testUnbalanced() {
		assertThrows("Close without open", IllegalStateException.class, () -> new WatBuilder().close());
		WatBuilder out = new WatBuilder().open("(module");
		assertThrows("Build with open s-expression", IllegalStateException.class, out::build);
	}
}
