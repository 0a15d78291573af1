package org.tensorscript.compiler.autocast;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.ir.TranslatedExpression;
import org.tensorscript.compiler.schema.OpSchema;

import java.util.List;
import java.util.Optional;

/**
 * The compile-time autocast specialization.
 * <p>
 * A non-constant operand serves as the type witness of its type variable. A constant operand whose
 * type variable has a witness is wrapped in {@code CastLike(constant, witness)}; every other operand
 * is used as is. An omitted operand ({@code null}) becomes the empty input name.
 */
public final class StaticAutoCast {

    /**
     * Emits the {@code CastLike} node for a constant operand.
     */
    @FunctionalInterface
    public interface CastLikeEmitter {
        /**
         * @param value The name of the constant operand.
         * @param witness The name of the operand whose type it must take.
         * @return The name of the cast result.
         */
        String castLike(String value, String witness);
    }

    private StaticAutoCast() {}

    /**
     * Casts the operands of one node.
     * @param schema The operator schema, or {@code null}.
     * @param args The translated operands; {@code null} marks an omitted optional input.
     * @param emitter Emits cast nodes.
     * @param source The call position.
     * @return The input names for the node.
     */
    public static List<String> castInputs(OpSchema schema, List<TranslatedExpression> args, CastLikeEmitter emitter,
                                          SourceInfo source) {
        return AutoCaster.<TranslatedExpression, String, String>castInputs(
                schema,
                args,
                arg -> arg == null || arg.isConstant() ? Optional.empty() : Optional.of(arg.name()),
                (arg, witness) -> {
                    if (arg == null) return "";
                    if (arg.isConstant() && witness.isPresent()) {
                        return emitter.castLike(arg.name(), witness.get());
                    }
                    return arg.name();
                },
                source);
    }
}
