package org.tensorscript.compiler.autocast;

import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.schema.FormalParameter;
import org.tensorscript.compiler.schema.OpSchema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The type-unification pass shared by the compiled and the interpreted path.
 * <p>
 * In a first pass every type variable of the operator is bound to the type of the first actual
 * argument whose type the inspector can tell. Later arguments never rebind a variable; there is
 * no conflict detection. In a second pass every argument is handed to the cast function together
 * with the binding of its formal parameter's type variable, if any. Concrete formal types and
 * arguments of heterogeneous variadic parameters are cast without a binding.
 */
public final class AutoCaster {

    private AutoCaster() {}

    /**
     * Casts the actual arguments of one operator call.
     *
     * @param schema The operator schema, or {@code null} if the operator is unknown.
     * @param args The actual arguments.
     * @param typeOf Inspector returning the statically known type of an argument.
     * @param cast Cast function receiving an argument and the binding of its type variable.
     * @param source The call position, for error reporting.
     * @param <A> The argument representation.
     * @param <T> The type representation used for bindings.
     * @param <R> The cast result.
     * @return The cast arguments, one per actual argument.
     * @throws ArityException if there are more arguments than formal parameters and the last formal is not variadic.
     */
    public static <A, T, R> List<R> castInputs(OpSchema schema, List<A> args,
                                               Function<? super A, Optional<T>> typeOf,
                                               BiFunction<? super A, Optional<T>, R> cast,
                                               SourceInfo source) {
        List<R> result = new ArrayList<>(args.size());
        if (schema == null) {
            for (A arg : args) {
                result.add(cast.apply(arg, Optional.empty()));
            }
            return result;
        }

        List<FormalParameter> formals = schema.inputs();
        List<String> typeVars = new ArrayList<>(args.size());
        Map<String, T> bindings = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            FormalParameter formal = formalFor(schema, formals, i, args.size(), source);
            String typeVar = formal.isTypeVariable() && (!formal.isVariadic() || formal.homogeneous())
                    ? formal.typeStr()
                    : null;
            typeVars.add(typeVar);
            if (typeVar != null && !bindings.containsKey(typeVar)) {
                typeOf.apply(args.get(i)).ifPresent(t -> bindings.put(typeVar, t));
            }
        }

        for (int i = 0; i < args.size(); i++) {
            String typeVar = typeVars.get(i);
            Optional<T> binding = typeVar == null ? Optional.empty() : Optional.ofNullable(bindings.get(typeVar));
            result.add(cast.apply(args.get(i), binding));
        }
        return result;
    }

    private static FormalParameter formalFor(OpSchema schema, List<FormalParameter> formals, int index, int actualCount,
                                             SourceInfo source) {
        if (index < formals.size()) {
            return formals.get(index);
        }
        if (!formals.isEmpty() && formals.get(formals.size() - 1).isVariadic()) {
            return formals.get(formals.size() - 1);
        }
        throw new ArityException("Number of actual parameters " + actualCount
                + " exceeds number of formal parameters " + formals.size() + " of '" + schema.name() + "'.", source);
    }
}
