package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pyken.errors.TopLevelIssueContext;
import pyken.model.python.PythonBinaryOperator;
import pyken.model.python.PythonComparisonOperator;
import pyken.model.python.PythonExpression;
import pyken.model.python.PythonUnaryOperator;
import pyken.scope.NameScope;

@RunWith(Parameterized.class)
public class PythonExpressionCodeGenVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// literals
				{ bool(true), "True", 0 },
				{ num(42), "42", 0 },
				{ num(-3), "-3", 0 },
				{ floatNum("1.5"), "1.5", 0 },
				{ str("say \"hi\""), "\"say \\\"hi\\\"\"", 0 },
				{ bytes("abc"), "\"abc\"", 0 },
				{ bytes(new byte[]{(byte) 0xff, (byte) 0xfe}), "#\"fffe\"", 0 },
				{ none(), "None", 0 },

				// reserved names
				{ name("datum"), "None", 0 },
				{ name("_redeemer"), "Void", 0 },
				{ attr("ctx", "redeemer"), "Void", 0 },
				{ call("Datum", name("x")), "None", 0 },
				{ call("Redeemer"), "Void", 0 },

				// attributes
				{ attr("self", "owner"), "owner", 0 },
				{ attr("Action", "Mint"), "Mint", 0 },
				{ attr("tx", "inputs"), "tx.inputs", 0 },
				{ attr(attr("ctx", "transaction"), "fee"), "ctx.transaction.fee", 0 },
				{ attr("handler", "else_"), "handler.else", 0 },

				// calls
				{ call("Some", name("x")), "Some(x)", 0 },
				{ call("None"), "None", 0 },
				{ call("Foo", num(1), str("a")), "Foo(1, \"a\")", 0 },
				{ call(name("Foo"), Collections.emptyList(), kw("amount", num(1)), kw("owner", name("o"))),
						"Foo { amount: 1, owner: o }", 0 },
				{ call("Unit"), "Unit", 0 },
				{ call(attr("types", "Foo"), num(1)), "Foo(1)", 0 },
				{ call(name("f"), exprs(num(1)), kw("limit", num(2))), "f(1, limit: 2)", 0 },
				{ call(attr("list", "length"), name("xs")), "list.length(xs)", 0 },
				{ call(attr("value", "pipe"), name("add"), num(1)), "value |> add(1)", 0 },
				{ call(attr("value", "pipe"), name("negate")), "value |> negate", 0 },
				{ call("print", str("checking")), "trace @\"checking\"", 0 },
				{ call(name("f"), Collections.emptyList(), kw(null, name("opts"))), "f(todo)", 1 },

				// arithmetic and precedence
				{ binop(name("a"), PythonBinaryOperator.ADD, name("b")), "a + b", 0 },
				{ binop(binop(name("a"), PythonBinaryOperator.ADD, name("b")), PythonBinaryOperator.MULT, name("c")),
						"(a + b) * c", 0 },
				{ binop(name("a"), PythonBinaryOperator.SUB, binop(name("b"), PythonBinaryOperator.SUB, name("c"))),
						"a - (b - c)", 0 },
				{ binop(binop(name("a"), PythonBinaryOperator.SUB, name("b")), PythonBinaryOperator.SUB, name("c")),
						"a - b - c", 0 },
				{ binop(name("a"), PythonBinaryOperator.FLOOR_DIV, num(2)), "a / 2", 0 },
				{ binop(name("a"), PythonBinaryOperator.MOD, num(2)), "a % 2", 0 },
				{ binop(name("a"), PythonBinaryOperator.POW, num(2)), "todo", 1 },

				// boolean logic
				{ and(name("a"), name("b"), name("c")), "a && b && c", 0 },
				{ and(or(name("a"), name("b")), name("c")), "(a || b) && c", 0 },
				{ or(and(name("a"), name("b")), name("c")), "a && b || c", 0 },
				{ not(name("ok")), "!ok", 0 },
				{ not(compare(name("a"), PythonComparisonOperator.EQ, name("b"))), "!(a == b)", 0 },
				{ unary(PythonUnaryOperator.U_SUB, name("x")), "-x", 0 },
				{ unary(PythonUnaryOperator.U_ADD, name("x")), "x", 0 },
				{ unary(PythonUnaryOperator.INVERT, name("x")), "todo", 1 },

				// comparisons
				{ compare(name("a"), PythonComparisonOperator.IS, none()), "a == None", 0 },
				{ compare(name("a"), PythonComparisonOperator.IS_NOT, none()), "a != None", 0 },
				{ compare(name("a"), PythonComparisonOperator.GT_E, binop(name("b"), PythonBinaryOperator.ADD, num(1))),
						"a >= b + 1", 0 },
				{ compare(name("x"), PythonComparisonOperator.IN, name("xs")), "list.has(xs, x)", 0 },
				{ compare(name("x"), PythonComparisonOperator.NOT_IN, name("xs")), "!list.has(xs, x)", 0 },
				{ compare(name("a"), Arrays.asList(PythonComparisonOperator.LT, PythonComparisonOperator.LT),
						exprs(name("b"), name("c"))), "a < b && b < c", 0 },
				{ and(compare(name("a"), PythonComparisonOperator.EQ, num(1)), name("b")), "a == 1 && b", 0 },

				// containers
				{ list(num(1), num(2)), "[1, 2]", 0 },
				{ tuple(name("a"), name("b")), "(a, b)", 0 },
				{ dict(exprs(str("k")), exprs(num(1))), "{ \"k\": 1 }", 0 },
				{ dict(Collections.emptyList(), Collections.emptyList()), "{}", 0 },
				{ subscript(attr("tx", "outputs"), num(0)), "tx.outputs[0]", 0 },

				// comprehensions
				{ listComp(binop(name("x"), PythonBinaryOperator.MULT, num(2)), generator("x", name("xs"))),
						"list.map(xs, fn(x) { x * 2 })", 0 },
				{ listComp(name("x"), generator("x", name("xs"),
						compare(name("x"), PythonComparisonOperator.GT, num(0)), name("keep"))),
						"list.map(list.filter(xs, fn(x) { x > 0 && keep }), fn(x) { x })", 0 },
				{ call("any", genExp(compare(name("o"), PythonComparisonOperator.EQ, name("owner")),
						generator("o", name("signatories")))),
						"list.any(signatories, fn(o) { o == owner })", 0 },
				{ listComp(name("x"), generator("xs", name("xss")), generator("x", name("xs"))), "todo", 1 },

				// unknown shapes
				{ unsupportedExpr("Lambda"), "todo", 1 },
		});
	}

	private PythonExpression expression;
	private String expected;
	private int warnings;

	public PythonExpressionCodeGenVisitorTest(PythonExpression expression, String expected, int warnings) {
		this.expression = expression;
		this.expected = expected;
		this.warnings = warnings;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String rendered = expression.accept(new PythonExpressionCodeGenVisitor(ctx, new NameScope()));
		assertThat(rendered, is(expected));
		assertThat(ctx.getWarnings().size(), is(warnings));
		assertFalse(ctx.hasErrors());
	}

}
