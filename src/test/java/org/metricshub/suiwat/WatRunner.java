package org.metricshub.suiwat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the WebAssembly text produced by the compiler, so that tests can
 * check what a module does rather than how it is spelled. Only the
 * instructions the compiler emits are supported, all of them on i32 values
 * (plus the f64 constants it truncates).
 */
public final class WatRunner {

	private static final int PAGE_SIZE = 65536;
	private static final long MAX_ITERATIONS = 1_000_000L;

	private final Map<String, Integer> globals = new LinkedHashMap<String, Integer>();
	private final Map<String, String> globalExports = new HashMap<String, String>();
	private final Map<String, Func> functions = new HashMap<String, Func>();
	private final Map<String, String> functionExports = new HashMap<String, String>();
	private final List<Integer> printed = new ArrayList<Integer>();
	private ByteBuffer memory;
	private long iterations;

	private static final class Func {
		final List<String> params = new ArrayList<String>();
		final List<String> locals = new ArrayList<String>();
		final List<Node> body = new ArrayList<Node>();
	}

	/** An atom or a parenthesized list */
	static final class Node {
		final String atom;
		final List<Node> children;

		Node(String atom) {
			this.atom = atom;
			this.children = null;
		}

		Node(List<Node> children) {
			this.atom = null;
			this.children = children;
		}

		boolean isList() {
			return children != null;
		}

		String head() {
			return isList() && !children.isEmpty() && !children.get(0).isList() ? children.get(0).atom : null;
		}
	}

	private enum Kind {
		BRANCH,
		RETURN
	}

	/** Abrupt completion of a sequence of instructions */
	private static final class Signal {
		final Kind kind;
		final String label;

		Signal(Kind kind, String label) {
			this.kind = kind;
			this.label = label;
		}
	}

	private static final Signal RETURN = new Signal(Kind.RETURN, null);

	private WatRunner() {}

	/**
	 * @param wat text of one module
	 * @return a runner with the module instantiated
	 */
	public static WatRunner load(String wat) {
		WatRunner runner = new WatRunner();
		Node module = parse(wat);
		if (!"module".equals(module.head())) {
			throw new IllegalArgumentException("Not a module");
		}
		for (Node field : module.children.subList(1, module.children.size())) {
			runner.define(field);
		}
		return runner;
	}

	private void define(Node field) {
		String head = field.head();
		if ("import".equals(head)) {
			return;
		}
		if ("memory".equals(head)) {
			Node pages = field.children.get(field.children.size() - 1);
			memory = ByteBuffer.allocate(PAGE_SIZE * Integer.parseInt(pages.atom)).order(ByteOrder.LITTLE_ENDIAN);
		} else if ("global".equals(head)) {
			String name = field.children.get(1).atom;
			Node init = field.children.get(field.children.size() - 1);
			globals.put(name, Integer.parseInt(init.children.get(1).atom));
			for (Node child : field.children) {
				if ("export".equals(child.head())) {
					globalExports.put(unquote(child.children.get(1).atom), name);
				}
			}
		} else if ("func".equals(head)) {
			String name = field.children.get(1).atom;
			Func func = new Func();
			for (Node child : field.children.subList(2, field.children.size())) {
				String childHead = child.head();
				if ("export".equals(childHead)) {
					functionExports.put(unquote(child.children.get(1).atom), name);
				} else if ("param".equals(childHead)) {
					func.params.add(child.children.get(1).atom);
				} else if ("local".equals(childHead)) {
					func.locals.add(child.children.get(1).atom);
				} else if (!"result".equals(childHead)) {
					func.body.add(child);
				}
			}
			if (functions.put(name, func) != null) {
				throw new IllegalArgumentException("Duplicate function " + name);
			}
		} else {
			throw new IllegalArgumentException("Unsupported module field: " + head);
		}
	}

	/**
	 * Calls an exported function.
	 *
	 * @param export export name
	 * @param args arguments
	 * @return the result of the function
	 */
	public int invoke(String export, int... args) {
		String name = functionExports.get(export);
		if (name == null) {
			throw new IllegalArgumentException("No exported function " + export);
		}
		return call(name, args);
	}

	/**
	 * @param export export name of a global
	 * @return its current value
	 */
	public int global(String export) {
		String name = globalExports.get(export);
		if (name == null) {
			throw new IllegalArgumentException("No exported global " + export);
		}
		return globals.get(name);
	}

	/**
	 * @param name internal name of a global, e.g. {@code $heap_ptr}
	 * @return its current value
	 */
	public int internalGlobal(String name) {
		Integer value = globals.get(name);
		if (value == null) {
			throw new IllegalArgumentException("No global " + name);
		}
		return value;
	}

	public boolean hasMemory() {
		return memory != null;
	}

	/**
	 * @param address byte address
	 * @return the i32 stored there
	 */
	public int load(int address) {
		return memory.getInt(address);
	}

	/**
	 * @return every value passed to the print import, in order
	 */
	public List<Integer> printed() {
		return printed;
	}

	private int call(String name, int[] args) {
		Func func = functions.get(name);
		if (func == null) {
			throw new IllegalStateException("Unknown function " + name);
		}
		Map<String, Number> locals = new HashMap<String, Number>();
		for (int i = 0; i < func.params.size(); i++) {
			locals.put(func.params.get(i), args[i]);
		}
		for (String local : func.locals) {
			locals.put(local, 0);
		}
		Deque<Number> stack = new ArrayDeque<Number>();
		Signal signal = execAll(func.body, locals, stack);
		if (signal != null && signal.kind == Kind.BRANCH) {
			throw new IllegalStateException("Branch to unknown label " + signal.label);
		}
		return stack.pop().intValue();
	}

	private Signal execAll(List<Node> instructions, Map<String, Number> locals, Deque<Number> stack) {
		for (Node insn : instructions) {
			Signal signal = exec(insn, locals, stack);
			if (signal != null) {
				return signal;
			}
		}
		return null;
	}

	private Signal exec(Node insn, Map<String, Number> locals, Deque<Number> stack) {
		String op = insn.head();
		List<Node> args = insn.children.subList(1, insn.children.size());
		if ("block".equals(op) || "loop".equals(op)) {
			String label = !args.isEmpty() && !args.get(0).isList() ? args.get(0).atom : null;
			List<Node> body = label == null ? args : args.subList(1, args.size());
			while (true) {
				if (++iterations > MAX_ITERATIONS) {
					throw new IllegalStateException("Too many iterations, infinite loop?");
				}
				Signal signal = execAll(body, locals, stack);
				if (signal != null && signal.kind == Kind.BRANCH && signal.label.equals(label)) {
					if ("loop".equals(op)) {
						continue;
					}
					return null;
				}
				return signal;
			}
		}
		if ("if".equals(op)) {
			List<Node> thenBody = null;
			List<Node> elseBody = null;
			for (Node arg : args) {
				if ("then".equals(arg.head())) {
					thenBody = arg.children.subList(1, arg.children.size());
				} else if ("else".equals(arg.head())) {
					elseBody = arg.children.subList(1, arg.children.size());
				} else {
					Signal signal = exec(arg, locals, stack);
					if (signal != null) {
						return signal;
					}
				}
			}
			int condition = stack.pop().intValue();
			List<Node> chosen = condition != 0 ? thenBody : elseBody;
			return chosen == null ? null : execAll(chosen, locals, stack);
		}
		if ("br".equals(op)) {
			return new Signal(Kind.BRANCH, args.get(0).atom);
		}
		if ("return".equals(op)) {
			return RETURN;
		}

		// folded operands first, then the instruction itself
		List<String> immediates = new ArrayList<String>();
		for (Node arg : args) {
			if (arg.isList()) {
				Signal signal = exec(arg, locals, stack);
				if (signal != null) {
					return signal;
				}
			} else {
				immediates.add(arg.atom);
			}
		}
		apply(op, immediates, locals, stack);
		return null;
	}

	private void apply(String op, List<String> immediates, Map<String, Number> locals, Deque<Number> stack) {
		int b;
		int a;
		switch (op) {
		case "local.get":
			stack.push(requireLocal(locals, immediates.get(0)));
			return;
		case "local.set":
			requireLocal(locals, immediates.get(0));
			locals.put(immediates.get(0), stack.pop().intValue());
			return;
		case "global.get":
			stack.push(internalGlobal(immediates.get(0)));
			return;
		case "global.set":
			internalGlobal(immediates.get(0));
			globals.put(immediates.get(0), stack.pop().intValue());
			return;
		case "i32.const":
			stack.push((int) Long.parseLong(immediates.get(0)));
			return;
		case "f64.const":
			stack.push(Double.parseDouble(immediates.get(0)));
			return;
		case "i32.trunc_f64_s":
			stack.push((int) stack.pop().doubleValue());
			return;
		case "i32.eqz":
			stack.push(stack.pop().intValue() == 0 ? 1 : 0);
			return;
		case "i32.load":
			stack.push(memory.getInt(stack.pop().intValue()));
			return;
		case "i32.store":
			b = stack.pop().intValue();
			a = stack.pop().intValue();
			memory.putInt(a, b);
			return;
		case "call":
			String target = immediates.get(0);
			if ("$print_i32".equals(target)) {
				printed.add(stack.pop().intValue());
				return;
			}
			Func func = functions.get(target);
			if (func == null) {
				throw new IllegalStateException("Unknown function " + target);
			}
			int[] callArgs = new int[func.params.size()];
			for (int i = callArgs.length - 1; i >= 0; i--) {
				callArgs[i] = stack.pop().intValue();
			}
			stack.push(call(target, callArgs));
			return;
		default:
			break;
		}
		b = stack.pop().intValue();
		a = stack.pop().intValue();
		stack.push(binary(op, a, b));
	}

	private static int binary(String op, int a, int b) {
		switch (op) {
		case "i32.add":
			return a + b;
		case "i32.sub":
			return a - b;
		case "i32.mul":
			return a * b;
		case "i32.div_s":
			if (b == 0) {
				throw new ArithmeticException("integer divide by zero");
			}
			return a / b;
		case "i32.rem_s":
			if (b == 0) {
				throw new ArithmeticException("integer divide by zero");
			}
			return a % b;
		case "i32.lt_s":
			return a < b ? 1 : 0;
		case "i32.gt_s":
			return a > b ? 1 : 0;
		case "i32.eq":
			return a == b ? 1 : 0;
		case "i32.and":
			return a & b;
		case "i32.or":
			return a | b;
		default:
			throw new UnsupportedOperationException("Unsupported instruction: " + op);
		}
	}

	private static Number requireLocal(Map<String, Number> locals, String name) {
		Number value = locals.get(name);
		if (value == null) {
			throw new IllegalStateException("Undeclared local " + name);
		}
		return value;
	}

	private static String unquote(String s) {
		return s.substring(1, s.length() - 1);
	}

	/**
	 * @param text WebAssembly text
	 * @return the first s-expression of the text
	 */
	static Node parse(String text) {
		Deque<List<Node>> open = new ArrayDeque<List<Node>>();
		List<Node> top = new ArrayList<Node>();
		open.push(top);
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == ';' && i + 1 < text.length() && text.charAt(i + 1) == ';') {
				while (i < text.length() && text.charAt(i) != '\n') {
					i++;
				}
			} else if (Character.isWhitespace(c)) {
				i++;
			} else if (c == '(') {
				open.push(new ArrayList<Node>());
				i++;
			} else if (c == ')') {
				List<Node> list = open.pop();
				open.peek().add(new Node(list));
				i++;
			} else if (c == '"') {
				int j = i + 1;
				while (text.charAt(j) != '"') {
					j += text.charAt(j) == '\\' ? 2 : 1;
				}
				open.peek().add(new Node(text.substring(i, j + 1)));
				i = j + 1;
			} else {
				int j = i;
				while (j < text.length() && !Character.isWhitespace(text.charAt(j)) && text.charAt(j) != '(' && text.charAt(j) != ')') {
					j++;
				}
				open.peek().add(new Node(text.substring(i, j)));
				i = j;
			}
		}
		if (open.size() != 1 || top.size() != 1) {
			throw new IllegalArgumentException("Unbalanced s-expressions");
		}
		return top.get(0);
	}
}
