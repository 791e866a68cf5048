package io.templatekit.core.build;

import io.templatekit.core.ast.ExpressionNode;
import io.templatekit.core.ast.FunctionCallNode;
import java.util.List;
import java.util.Optional;

/**
 * Argument-count checks for functions and methods. Every failure is reported on the call's
 * argument-list span.
 */
public final class Arguments {

    private Arguments() {}

    /** Required arguments followed by any number of extra ones. */
    public record WithRest(List<ExpressionNode> required, List<ExpressionNode> rest) {

        public WithRest {
            required = List.copyOf(required);
            rest = List.copyOf(rest);
        }
    }

    /** Required arguments followed by the optional arguments actually supplied. */
    public record WithOptional(List<ExpressionNode> required, List<ExpressionNode> present) {

        public WithOptional {
            required = List.copyOf(required);
            present = List.copyOf(present);
        }

        /** The {@code index}-th optional argument, or empty if it was not supplied. */
        public Optional<ExpressionNode> optional(int index) {
            return index < present.size() ? Optional.of(present.get(index)) : Optional.empty();
        }
    }

    public static void expectNoArguments(FunctionCallNode function) {
        if (!function.args().isEmpty()) {
            throw BuildErrors.invalidArgumentCountExact(0, function);
        }
    }

    public static List<ExpressionNode> expectExactArguments(FunctionCallNode function, int count) {
        if (function.args().size() != count) {
            throw BuildErrors.invalidArgumentCountExact(count, function);
        }
        return function.args();
    }

    public static WithRest expectSomeArguments(FunctionCallNode function, int required) {
        var args = function.args();
        if (args.size() < required) {
            throw BuildErrors.invalidArgumentCountRangeFrom(required, function);
        }
        return new WithRest(args.subList(0, required), args.subList(required, args.size()));
    }

    public static WithOptional expectArguments(FunctionCallNode function, int required, int optional) {
        var args = function.args();
        if (args.size() < required || args.size() > required + optional) {
            throw BuildErrors.invalidArgumentCountRange(required, required + optional, function);
        }
        return new WithOptional(args.subList(0, required), args.subList(required, args.size()));
    }
}
