package pyken.trans.passes.declaration;

import pyken.model.declaration.*;
import pyken.model.python.*;
import pyken.util.Identifiers;

import java.util.*;

public class DeclarationCollectionVisitor extends PythonStatementVisitor<List<Declaration>, RuntimeException> {

	private static final Set<String> ENTRY_POINTS = new HashSet<>(Arrays.asList(
			"spend", "mint", "withdraw", "publish", "vote", "propose", EntryPoint.CATCH_ALL));

	private static final String CONSTRUCTOR = "__init__";

	private static List<Declaration> one(Declaration declaration) {
		return Collections.singletonList(declaration);
	}

	private static List<PythonArgument> withoutSelf(List<PythonArgument> arguments) {
		if (!arguments.isEmpty() && arguments.get(0).getName().equals("self")) {
			return arguments.subList(1, arguments.size());
		}
		return arguments;
	}

	@Override
	public List<Declaration> visit(PythonImport pythonImport) throws RuntimeException {
		List<Declaration> result = new ArrayList<>();
		for (PythonAlias alias : pythonImport.getAliases()) {
			result.add(new ImportDeclaration(pythonImport.getLocation(), alias.getName().replace('.', '/'),
					alias.getAsName(), Collections.emptyList()));
		}
		return result;
	}

	@Override
	public List<Declaration> visit(PythonImportFrom pythonImportFrom) throws RuntimeException {
		// from . import x
		if (pythonImportFrom.getModule() == null) {
			return Collections.emptyList();
		}
		List<String> names = new ArrayList<>();
		for (PythonAlias alias : pythonImportFrom.getAliases()) {
			if (alias.getAsName() != null) {
				names.add(alias.getName() + " as " + alias.getAsName());
			} else {
				names.add(alias.getName());
			}
		}
		return one(new ImportDeclaration(pythonImportFrom.getLocation(),
				pythonImportFrom.getModule().replace('.', '/'), null, names));
	}

	@Override
	public List<Declaration> visit(PythonClassDef pythonClassDef) throws RuntimeException {
		boolean isValidator = false;
		for (PythonStatement statement : pythonClassDef.getBody()) {
			if (statement instanceof PythonFunctionDef && ENTRY_POINTS.contains(((PythonFunctionDef) statement).getName())) {
				isValidator = true;
				break;
			}
		}
		if (isValidator) {
			return one(validator(pythonClassDef));
		}
		return one(record(pythonClassDef));
	}

	private static ValidatorDeclaration validator(PythonClassDef pythonClassDef) {
		List<PythonArgument> parameters = pythonClassDef.findMethod(CONSTRUCTOR)
				.map(init -> withoutSelf(init.getArguments()))
				.orElse(Collections.emptyList());
		List<EntryPoint> entryPoints = new ArrayList<>();
		for (PythonStatement statement : pythonClassDef.getBody()) {
			if (statement instanceof PythonFunctionDef) {
				PythonFunctionDef method = (PythonFunctionDef) statement;
				if (method.getName().equals(CONSTRUCTOR)) {
					continue;
				}
				entryPoints.add(new EntryPoint(method.getLocation(), method.getName(),
						withoutSelf(method.getArguments()), method.getBody()));
			}
		}
		return new ValidatorDeclaration(pythonClassDef.getLocation(), pythonClassDef.getName(), parameters, entryPoints);
	}

	private static RecordDeclaration record(PythonClassDef pythonClassDef) {
		Optional<PythonFunctionDef> init = pythonClassDef.findMethod(CONSTRUCTOR);
		if (init.isPresent()) {
			List<PythonArgument> fields = withoutSelf(init.get().getArguments());
			if (fields.isEmpty()) {
				return RecordDeclaration.nullary(pythonClassDef.getLocation(), pythonClassDef.getName());
			}
			return RecordDeclaration.withFields(pythonClassDef.getLocation(), pythonClassDef.getName(), fields,
					init.get().getBody());
		}

		// dataclass style: name: Type [= default]
		List<PythonArgument> annotatedFields = new ArrayList<>();
		for (PythonStatement statement : pythonClassDef.getBody()) {
			if (statement instanceof PythonAnnAssign && ((PythonAnnAssign) statement).getTarget() instanceof PythonName) {
				PythonAnnAssign field = (PythonAnnAssign) statement;
				annotatedFields.add(new PythonArgument(field.getLocation(), ((PythonName) field.getTarget()).getId(),
						field.getAnnotation(), field.getValue()));
			}
		}
		if (!annotatedFields.isEmpty()) {
			return RecordDeclaration.withFields(pythonClassDef.getLocation(), pythonClassDef.getName(),
					annotatedFields, pythonClassDef.getBody());
		}

		List<String> variants = enumerationVariants(pythonClassDef.getBody());
		if (!variants.isEmpty()) {
			return RecordDeclaration.enumeration(pythonClassDef.getLocation(), pythonClassDef.getName(), variants);
		}
		return RecordDeclaration.nullary(pythonClassDef.getLocation(), pythonClassDef.getName());
	}

	/**
	 * A body of the form {@code A = "a"; B = "b"} lists enumeration variants.
	 *
	 * @return the variant names, empty if the body has any other shape
	 */
	private static List<String> enumerationVariants(List<PythonStatement> body) {
		List<String> variants = new ArrayList<>();
		for (PythonStatement statement : body) {
			if (statement instanceof PythonPass ||
					(statement instanceof PythonExpressionStatement && ((PythonExpressionStatement) statement).isDocstring())) {
				continue;
			}
			if (!(statement instanceof PythonAssign)) {
				return Collections.emptyList();
			}
			PythonAssign assign = (PythonAssign) statement;
			String name = assign.getSingleTargetName();
			if (!Identifiers.isCapitalized(name) || !(assign.getValue() instanceof PythonStringLiteral)) {
				return Collections.emptyList();
			}
			variants.add(name);
		}
		return variants;
	}

	@Override
	public List<Declaration> visit(PythonFunctionDef pythonFunctionDef) throws RuntimeException {
		String name = pythonFunctionDef.getName();
		if (name.startsWith("test")) {
			String testName = name.startsWith("test_") ? name.substring("test_".length()) : name;
			return one(new TestDeclaration(pythonFunctionDef.getLocation(), testName, pythonFunctionDef.getBody()));
		}
		return one(new FunctionDeclaration(pythonFunctionDef.getLocation(), name, pythonFunctionDef.getArguments(),
				pythonFunctionDef.getReturns(), pythonFunctionDef.getBody()));
	}

	@Override
	public List<Declaration> visit(PythonAssign pythonAssign) throws RuntimeException {
		String name = pythonAssign.getSingleTargetName();
		if (name == null) {
			return one(new UnsupportedDeclaration(pythonAssign.getLocation(), "Assign"));
		}
		return one(new ConstantDeclaration(pythonAssign.getLocation(), name, null, pythonAssign.getValue()));
	}

	@Override
	public List<Declaration> visit(PythonAnnAssign pythonAnnAssign) throws RuntimeException {
		if (!(pythonAnnAssign.getTarget() instanceof PythonName) || pythonAnnAssign.getValue() == null) {
			return one(new UnsupportedDeclaration(pythonAnnAssign.getLocation(), "AnnAssign"));
		}
		return one(new ConstantDeclaration(pythonAnnAssign.getLocation(), ((PythonName) pythonAnnAssign.getTarget()).getId(),
				pythonAnnAssign.getAnnotation(), pythonAnnAssign.getValue()));
	}

	@Override
	public List<Declaration> visit(PythonAugAssign pythonAugAssign) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonAugAssign.getLocation(), "AugAssign"));
	}

	@Override
	public List<Declaration> visit(PythonIf pythonIf) throws RuntimeException {
		// if __name__ == "__main__":
		if (pythonIf.getTest() instanceof PythonCompare) {
			PythonExpression left = ((PythonCompare) pythonIf.getTest()).getLeft();
			if (left instanceof PythonName && ((PythonName) left).getId().equals("__name__")) {
				return Collections.emptyList();
			}
		}
		return one(new UnsupportedDeclaration(pythonIf.getLocation(), "If"));
	}

	@Override
	public List<Declaration> visit(PythonReturn pythonReturn) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonReturn.getLocation(), "Return"));
	}

	@Override
	public List<Declaration> visit(PythonAssert pythonAssert) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonAssert.getLocation(), "Assert"));
	}

	@Override
	public List<Declaration> visit(PythonRaise pythonRaise) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonRaise.getLocation(), "Raise"));
	}

	@Override
	public List<Declaration> visit(PythonTry pythonTry) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonTry.getLocation(), "Try"));
	}

	@Override
	public List<Declaration> visit(PythonExpressionStatement pythonExpressionStatement) throws RuntimeException {
		if (pythonExpressionStatement.isDocstring()) {
			return Collections.emptyList();
		}
		return one(new UnsupportedDeclaration(pythonExpressionStatement.getLocation(), "Expr"));
	}

	@Override
	public List<Declaration> visit(PythonPass pythonPass) throws RuntimeException {
		return Collections.emptyList();
	}

	@Override
	public List<Declaration> visit(PythonUnsupportedStatement pythonUnsupportedStatement) throws RuntimeException {
		return one(new UnsupportedDeclaration(pythonUnsupportedStatement.getLocation(), pythonUnsupportedStatement.getKind()));
	}
}
