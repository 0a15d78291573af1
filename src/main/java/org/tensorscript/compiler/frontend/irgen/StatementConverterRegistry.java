package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.frontend.irgen.converters.AnnAssignConverter;
import org.tensorscript.compiler.frontend.irgen.converters.AssignConverter;
import org.tensorscript.compiler.frontend.irgen.converters.ExprStmtConverter;
import org.tensorscript.compiler.frontend.irgen.converters.ForLoopConverter;
import org.tensorscript.compiler.frontend.irgen.converters.IfConverter;
import org.tensorscript.compiler.frontend.irgen.converters.NestedFunctionConverter;
import org.tensorscript.compiler.frontend.irgen.converters.NestedReturnConverter;
import org.tensorscript.compiler.frontend.irgen.converters.WhileLoopConverter;
import org.tensorscript.compiler.frontend.parser.ast.AnnAssignNode;
import org.tensorscript.compiler.frontend.parser.ast.AssignNode;
import org.tensorscript.compiler.frontend.parser.ast.ExprStmtNode;
import org.tensorscript.compiler.frontend.parser.ast.ForNode;
import org.tensorscript.compiler.frontend.parser.ast.FunctionDefNode;
import org.tensorscript.compiler.frontend.parser.ast.IfNode;
import org.tensorscript.compiler.frontend.parser.ast.ReturnNode;
import org.tensorscript.compiler.frontend.parser.ast.StmtNode;
import org.tensorscript.compiler.frontend.parser.ast.WhileNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping statement classes to converter instances.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(StmtNode)} method
 * walks the class hierarchy to find the nearest registered converter.
 */
public final class StatementConverterRegistry {

	private final Map<Class<? extends StmtNode>, IStatementConverter<? extends StmtNode>> byClass = new HashMap<>();
	private final IStatementConverter<StmtNode> defaultConverter;

	private StatementConverterRegistry(IStatementConverter<StmtNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given statement class.
	 *
	 * @param nodeType  The concrete statement class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete statement type parameter.
	 */
	public <T extends StmtNode> void register(Class<T> nodeType, IStatementConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Retrieves the converter strictly registered for the given class (no hierarchy search).
	 *
	 * @param nodeType The statement class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IStatementConverter<? extends StmtNode>> get(Class<? extends StmtNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves a converter for the given statement by searching its concrete class,
	 * then its interfaces. Falls back to the default converter.
	 *
	 * @param node The statement to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IStatementConverter<StmtNode> resolve(StmtNode node) {
		Class<?> c = node.getClass();
		while (c != null && StmtNode.class.isAssignableFrom(c)) {
			IStatementConverter<?> found = byClass.get(c);
			if (found != null) return (IStatementConverter<StmtNode>) found;
			for (Class<?> i : c.getInterfaces()) {
				if (StmtNode.class.isAssignableFrom(i)) {
					found = byClass.get(i.asSubclass(StmtNode.class));
					if (found != null) return (IStatementConverter<StmtNode>) found;
				}
			}
			c = c.getSuperclass();
		}
		return defaultConverter;
	}

	/**
	 * @return The fallback converter used when no specific converter is registered.
	 */
	public IStatementConverter<StmtNode> defaultConverter() {
		return defaultConverter;
	}

	/**
	 * Creates a registry with the given default converter and no registrations.
	 *
	 * @param defaultConverter The fallback converter used for unknown statement types.
	 * @return A new registry instance.
	 */
	public static StatementConverterRegistry initialize(IStatementConverter<StmtNode> defaultConverter) {
		return new StatementConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the unsupported-statement fallback and registers all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static StatementConverterRegistry initializeWithDefaults() {
		StatementConverterRegistry reg = initialize(new UnsupportedStatementConverter());
		reg.register(AssignNode.class, new AssignConverter());
		reg.register(AnnAssignNode.class, new AnnAssignConverter());
		reg.register(ExprStmtNode.class, new ExprStmtConverter());
		reg.register(IfNode.class, new IfConverter());
		reg.register(ForNode.class, new ForLoopConverter());
		reg.register(WhileNode.class, new WhileLoopConverter());
		reg.register(FunctionDefNode.class, new NestedFunctionConverter());
		reg.register(ReturnNode.class, new NestedReturnConverter());
		return reg;
	}
}
