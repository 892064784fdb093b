package pyken.model.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first enumeration of every node below a statement list, in the order Python's
 * {@code ast.walk} would produce them.
 */
public class PythonWalk {

	private PythonWalk() {}

	public static List<PythonNode> walk(List<PythonStatement> statements) {
		List<PythonNode> result = new ArrayList<>();
		Deque<PythonNode> queue = new ArrayDeque<>(statements);
		while (!queue.isEmpty()) {
			PythonNode node = queue.removeFirst();
			result.add(node);
			queue.addAll(children(node));
		}
		return result;
	}

	static List<PythonNode> children(PythonNode node) {
		if (node instanceof PythonStatement) {
			return ((PythonStatement) node).accept(new StatementChildren());
		}
		if (node instanceof PythonExpression) {
			return ((PythonExpression) node).accept(new ExpressionChildren());
		}
		if (node instanceof PythonArgument) {
			PythonArgument argument = (PythonArgument) node;
			return nonNull(argument.getAnnotation(), argument.getDefaultValue());
		}
		if (node instanceof PythonKeyword) {
			return nonNull(((PythonKeyword) node).getValue());
		}
		if (node instanceof PythonExceptHandler) {
			PythonExceptHandler handler = (PythonExceptHandler) node;
			List<PythonNode> result = nonNull(handler.getType());
			result.addAll(handler.getBody());
			return result;
		}
		if (node instanceof PythonGenerator) {
			PythonGenerator generator = (PythonGenerator) node;
			List<PythonNode> result = nonNull(generator.getTarget(), generator.getIterable());
			result.addAll(generator.getConditions());
			return result;
		}
		if (node instanceof PythonModule) {
			return new ArrayList<>(((PythonModule) node).getBody());
		}
		return Collections.emptyList();
	}

	private static List<PythonNode> nonNull(PythonNode... nodes) {
		List<PythonNode> result = new ArrayList<>();
		for (PythonNode node : nodes) {
			if (node != null) {
				result.add(node);
			}
		}
		return result;
	}

	@SafeVarargs
	private static List<PythonNode> concat(List<? extends PythonNode>... lists) {
		List<PythonNode> result = new ArrayList<>();
		for (List<? extends PythonNode> list : lists) {
			for (PythonNode node : list) {
				if (node != null) {
					result.add(node);
				}
			}
		}
		return result;
	}

	private static class StatementChildren extends PythonStatementVisitor<List<PythonNode>, RuntimeException> {

		@Override
		public List<PythonNode> visit(PythonImport pythonImport) {
			return concat(pythonImport.getAliases());
		}

		@Override
		public List<PythonNode> visit(PythonImportFrom pythonImportFrom) {
			return concat(pythonImportFrom.getAliases());
		}

		@Override
		public List<PythonNode> visit(PythonClassDef pythonClassDef) {
			return concat(pythonClassDef.getDecorators(), pythonClassDef.getBases(), pythonClassDef.getBody());
		}

		@Override
		public List<PythonNode> visit(PythonFunctionDef pythonFunctionDef) {
			return concat(pythonFunctionDef.getDecorators(), pythonFunctionDef.getArguments(),
					pythonFunctionDef.getBody(), nonNull(pythonFunctionDef.getReturns()));
		}

		@Override
		public List<PythonNode> visit(PythonAssign pythonAssign) {
			return concat(pythonAssign.getTargets(), nonNull(pythonAssign.getValue()));
		}

		@Override
		public List<PythonNode> visit(PythonAnnAssign pythonAnnAssign) {
			return nonNull(pythonAnnAssign.getTarget(), pythonAnnAssign.getAnnotation(), pythonAnnAssign.getValue());
		}

		@Override
		public List<PythonNode> visit(PythonAugAssign pythonAugAssign) {
			return nonNull(pythonAugAssign.getTarget(), pythonAugAssign.getValue());
		}

		@Override
		public List<PythonNode> visit(PythonIf pythonIf) {
			return concat(nonNull(pythonIf.getTest()), pythonIf.getBody(), pythonIf.getOrElse());
		}

		@Override
		public List<PythonNode> visit(PythonReturn pythonReturn) {
			return nonNull(pythonReturn.getValue());
		}

		@Override
		public List<PythonNode> visit(PythonAssert pythonAssert) {
			return nonNull(pythonAssert.getTest(), pythonAssert.getMessage());
		}

		@Override
		public List<PythonNode> visit(PythonRaise pythonRaise) {
			return nonNull(pythonRaise.getException());
		}

		@Override
		public List<PythonNode> visit(PythonTry pythonTry) {
			return concat(pythonTry.getBody(), pythonTry.getHandlers(), pythonTry.getOrElse(),
					pythonTry.getFinalBody());
		}

		@Override
		public List<PythonNode> visit(PythonExpressionStatement pythonExpressionStatement) {
			return nonNull(pythonExpressionStatement.getValue());
		}

		@Override
		public List<PythonNode> visit(PythonPass pythonPass) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonUnsupportedStatement pythonUnsupportedStatement) {
			return Collections.emptyList();
		}
	}

	private static class ExpressionChildren extends PythonExpressionVisitor<List<PythonNode>, RuntimeException> {

		@Override
		public List<PythonNode> visit(PythonBooleanLiteral pythonBooleanLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonIntegerLiteral pythonIntegerLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonFloatLiteral pythonFloatLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonStringLiteral pythonStringLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonBytesLiteral pythonBytesLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonNoneLiteral pythonNoneLiteral) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonName pythonName) {
			return Collections.emptyList();
		}

		@Override
		public List<PythonNode> visit(PythonAttribute pythonAttribute) {
			return nonNull(pythonAttribute.getValue());
		}

		@Override
		public List<PythonNode> visit(PythonCall pythonCall) {
			return concat(nonNull(pythonCall.getFunction()), pythonCall.getArguments(), pythonCall.getKeywords());
		}

		@Override
		public List<PythonNode> visit(PythonBinOp pythonBinOp) {
			return nonNull(pythonBinOp.getLeft(), pythonBinOp.getRight());
		}

		@Override
		public List<PythonNode> visit(PythonBoolOp pythonBoolOp) {
			return concat(pythonBoolOp.getValues());
		}

		@Override
		public List<PythonNode> visit(PythonUnaryOp pythonUnaryOp) {
			return nonNull(pythonUnaryOp.getOperand());
		}

		@Override
		public List<PythonNode> visit(PythonCompare pythonCompare) {
			return concat(nonNull(pythonCompare.getLeft()), pythonCompare.getComparators());
		}

		@Override
		public List<PythonNode> visit(PythonList pythonList) {
			return concat(pythonList.getElements());
		}

		@Override
		public List<PythonNode> visit(PythonTuple pythonTuple) {
			return concat(pythonTuple.getElements());
		}

		@Override
		public List<PythonNode> visit(PythonDict pythonDict) {
			return concat(pythonDict.getKeys(), pythonDict.getValues());
		}

		@Override
		public List<PythonNode> visit(PythonSubscript pythonSubscript) {
			return nonNull(pythonSubscript.getValue(), pythonSubscript.getIndex());
		}

		@Override
		public List<PythonNode> visit(PythonComprehension pythonComprehension) {
			return concat(nonNull(pythonComprehension.getElement()), pythonComprehension.getGenerators());
		}

		@Override
		public List<PythonNode> visit(PythonUnsupportedExpression pythonUnsupportedExpression) {
			return Collections.emptyList();
		}
	}
}
