package pyken.trans.passes.type;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import org.junit.Test;

import pyken.model.python.PythonBinaryOperator;
import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeSymbol;

public class ReturnTypeInferenceVisitorTest {

	@Test
	public void returnsInsideBranchesAreUnified() {
		TypeSymbol type = ReturnTypeInferenceVisitor.inferReturnType(body(
				ifStmt(name("c"), ret(num(1))),
				ret(num(2))));
		assertThat(type.getName(), is("Int"));
	}

	@Test
	public void unknownValuesAreSkipped() {
		TypeSymbol type = ReturnTypeInferenceVisitor.inferReturnType(body(
				ifStmt(name("c"), ret(name("x"))),
				ret(binop(str("a"), PythonBinaryOperator.ADD, name("y")))));
		assertThat(type.getName(), is("String"));
	}

	@Test
	public void conflictingReturnsDegrade() {
		TypeSymbol type = ReturnTypeInferenceVisitor.inferReturnType(body(
				ifStmt(name("c"), ret(num(1))),
				ret(str("no"))));
		assertTrue(type.isWildcard());
	}

	@Test
	public void conflictIsNotUndoneByLaterReturns() {
		TypeSymbol first = ReturnTypeInferenceVisitor.inferReturnType(body(
				ifStmt(name("a"), ret(str("x"))),
				ifStmt(name("b"), ret(num(1))),
				ret(str("y"))));
		TypeSymbol second = ReturnTypeInferenceVisitor.inferReturnType(body(
				ifStmt(name("a"), ret(str("x"))),
				ifStmt(name("b"), ret(str("y"))),
				ret(num(1))));
		assertTrue(first.isWildcard());
		assertThat(first.getProvenance(), is(TypeProvenance.FALLBACK));
		assertThat(first, is(second));
	}

	@Test
	public void nothingKnown() {
		assertThat(ReturnTypeInferenceVisitor.inferReturnType(body(ret(name("x")))), is(nullValue()));
		assertThat(ReturnTypeInferenceVisitor.inferReturnType(body(ret())), is(nullValue()));
	}

}
