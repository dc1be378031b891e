package org.metricshub.suiwat.backend;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;
import org.metricshub.suiwat.SuiWat;
import org.metricshub.suiwat.intermediate.SuiModule;
import org.metricshub.suiwat.util.FallbackPolicy;
import org.metricshub.suiwat.util.ScriptSource;

public class ModuleAssemblerTest {

	private static String assemble(String... lines) throws IOException {
		String code = String.join("\n", lines) + "\n";
		SuiModule module = new SuiWat().parse(new ScriptSource("test", new StringReader(code)));
		return new ModuleAssembler(new ControlFlowReconstructor(FallbackPolicy.LENIENT)).assemble(module);
	}

	@Test
	public void testStraightLineProgram() throws Exception {
		String expected = String.join(
				"\n",
				"(module",
				"  ;; External function imports",
				"  (import \"env\" \"print_i32\" (func $print_i32 (param i32)))",
				"",
				"  ;; Global variables",
				"  (global $g0 (export \"g0\") (mut i32) (i32.const 0))",
				"  (global $g1 (export \"g1\") (mut i32) (i32.const 0))",
				"",
				"  ;; Main function",
				"  (func $main (export \"main\") (result i32)",
				"    (i32.const 10)",
				"    (global.set $g0)",
				"    (global.get $g0)",
				"    (i32.const 5)",
				"    (i32.add)",
				"    (global.set $g1)",
				"    (global.get $g1)",
				"    (call $print_i32)",
				"    (i32.const 0)",
				"  )",
				")");
		assertEquals(expected, assemble("= g0 10", "+ g1 g0 5", ". g1"));
	}

	@Test
	public void testFunctionsAndLocals() throws Exception {
		String wat = assemble(
				"# 2 2",
				"+ v1 a0 a1",
				"^ v1",
				"}",
				"# 1 0",
				"^ 7",
				"}",
				"$ v0 2 3 4",
				"$ v3 1",
				". v0");
		assertTrue(wat, wat.contains("  ;; Function definitions\n  (func $f1 (result i32)\n"));
		assertTrue(wat, wat.contains("  (func $f2 (param $a0 i32) (param $a1 i32) (result i32)\n    (local $v1 i32)\n"));
		assertTrue("Functions ascending by id", wat.indexOf("$f1 (result") < wat.indexOf("$f2 (param"));
		assertTrue(wat, wat.contains("(func $main (export \"main\") (result i32)\n    (local $v0 i32)\n    (local $v3 i32)\n"));
		assertFalse("No globals section", wat.contains(";; Global variables"));
		assertFalse("No memory", wat.contains("(memory"));
	}

	@Test
	public void testNestedFunctionIsHoisted() throws Exception {
		String wat = assemble("# 1 0", "# 2 0", "^ 2", "}", "$ v0 2", "^ v0", "}", "$ g0 1");
		assertTrue(wat, wat.contains("(func $f1 (result i32)"));
		assertTrue(wat, wat.contains("(func $f2 (result i32)"));
		int f1 = wat.indexOf("(func $f1");
		int f2 = wat.indexOf("(func $f2");
		assertTrue("Nested function is not emitted inside its parent", wat.lastIndexOf("\n  )", f2) > f1);
	}

	@Test
	public void testMemoryOnlyWhenArraysAreUsed() throws Exception {
		assertFalse(assemble("= g0 1").contains("(memory"));
		String wat = assemble("# 1 0", "[ v0 2", "^ v0", "}", "$ g0 1");
		assertTrue(wat, wat.contains("  ;; Linear memory and heap pointer\n  (memory (export \"memory\") 1)\n  (global $heap_ptr (mut i32) (i32.const 0))\n"));
	}

	@Test
	public void testGlobalsFromEveryScope() throws Exception {
		String wat = assemble("# 1 0", "= g7 1", "^ g3", "}", "= g5 1");
		int g3 = wat.indexOf("(global $g3 ");
		int g5 = wat.indexOf("(global $g5 ");
		int g7 = wat.indexOf("(global $g7 ");
		assertTrue(wat, g3 > 0 && g3 < g5 && g5 < g7);
	}

	@Test
	public void testStateLocalOnlyWithLabels() throws Exception {
		assertFalse(assemble("@ 1").contains("$state"));
		String wat = assemble(": 1", "@ 1");
		assertTrue(wat, wat.contains("(local $state i32)"));
	}

	@Test
	public void testDeterministic() throws Exception {
		String[] program = { "# 3 1", ": 4", "? a0 2", ": 2", "{ g1 0 a0", "^ 0", "}", "[ g1 4", "$ v9 3 g2", ". v9" };
		assertEquals(assemble(program), assemble(program));
	}
}
