package io.templatekit.core.ast;

import io.templatekit.core.error.TemplateParseErrorKind;
import io.templatekit.core.error.TemplateParseException;
import io.templatekit.core.syntax.CstNode;
import io.templatekit.core.syntax.TemplateRule;
import io.templatekit.core.syntax.TemplateSyntaxParser;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the concrete syntax tree into {@link ExpressionNode}s. Decodes string escapes and
 * integer literals, collapses single-term templates and folds method chains into nested {@link
 * MethodCallNode}s. No name or type checking happens here.
 *
 * <p>The CST shape is fixed by {@link TemplateSyntaxParser}; a node that does not fit it is a
 * defect and raises {@link IllegalStateException}.
 */
public final class AstBuilder {

    private AstBuilder() {}

    /**
     * Parses template text into an AST.
     *
     * @param source template source text
     * @return the root node; an empty {@link ExpressionKind.TemplateList} for blank input
     * @throws TemplateParseException on syntax errors or out-of-range integer literals
     */
    public static ExpressionNode parse(String source) {
        return build(TemplateSyntaxParser.parse(source));
    }

    /** Builds the AST for a {@link TemplateRule#PROGRAM} node. */
    public static ExpressionNode build(CstNode.NonTerminal program) {
        expectRule(program, TemplateRule.PROGRAM);
        if (program.children().isEmpty()) {
            return new ExpressionNode(new ExpressionKind.TemplateList(List.of()), program.span());
        }
        return buildTemplate(program.children().get(0));
    }

    private static ExpressionNode buildTemplate(CstNode node) {
        var template = expectNonTerminal(node, TemplateRule.TEMPLATE);
        List<ExpressionNode> terms = new ArrayList<>();
        for (CstNode child : template.children()) {
            terms.add(buildTerm(child));
        }
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return new ExpressionNode(new ExpressionKind.TemplateList(terms), template.span());
    }

    private static ExpressionNode buildTerm(CstNode node) {
        var term = expectNonTerminal(node, TemplateRule.TERM);
        var children = term.children();
        ExpressionNode result = buildPrimary(children.get(0));
        for (CstNode chain : children.subList(1, children.size())) {
            var method = new MethodCallNode(result, buildFunctionCall(chain));
            result = new ExpressionNode(new ExpressionKind.MethodCall(method), chain.span());
        }
        return result;
    }

    private static ExpressionNode buildPrimary(CstNode node) {
        switch (node.rule()) {
            case LITERAL:
                return new ExpressionNode(new ExpressionKind.StringLiteral(decodeStringLiteral(node)), node.span());
            case INTEGER_LITERAL:
                return new ExpressionNode(new ExpressionKind.IntegerLiteral(parseInteger(node)), node.span());
            case IDENTIFIER:
                return new ExpressionNode(new ExpressionKind.Identifier(text(node)), node.span());
            case FUNCTION:
                return new ExpressionNode(new ExpressionKind.FunctionCall(buildFunctionCall(node)), node.span());
            case TEMPLATE:
                return buildTemplate(node);
            default:
                throw new IllegalStateException("Unexpected term: " + node.rule());
        }
    }

    private static FunctionCallNode buildFunctionCall(CstNode node) {
        var function = expectNonTerminal(node, TemplateRule.FUNCTION);
        CstNode name = function.children().get(0);
        var arguments = expectNonTerminal(function.children().get(1), TemplateRule.FUNCTION_ARGUMENTS);
        expectRule(name, TemplateRule.IDENTIFIER);
        List<ExpressionNode> args = new ArrayList<>();
        for (CstNode argument : arguments.children()) {
            args.add(buildTemplate(argument));
        }
        return new FunctionCallNode(text(name), name.span(), args, arguments.span());
    }

    private static String decodeStringLiteral(CstNode node) {
        var literal = expectNonTerminal(node, TemplateRule.LITERAL);
        var result = new StringBuilder();
        for (CstNode part : literal.children()) {
            String text = text(part);
            if (part.rule() == TemplateRule.RAW_LITERAL) {
                result.append(text);
            } else if (part.rule() == TemplateRule.ESCAPE) {
                switch (text.charAt(1)) {
                    case '"':
                        result.append('"');
                        break;
                    case '\\':
                        result.append('\\');
                        break;
                    case 'n':
                        result.append('\n');
                        break;
                    default:
                        throw new IllegalStateException("Invalid escape: " + text);
                }
            } else {
                throw new IllegalStateException("Unexpected part of string: " + part.rule());
            }
        }
        return result.toString();
    }

    private static long parseInteger(CstNode node) {
        String text = text(node);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new TemplateParseException(new TemplateParseErrorKind.ParseIntError(text), node.span(), e);
        }
    }

    private static String text(CstNode node) {
        if (node instanceof CstNode.Terminal terminal) {
            return terminal.text();
        }
        throw new IllegalStateException("Expected a terminal node, got " + node.rule());
    }

    private static CstNode.NonTerminal expectNonTerminal(CstNode node, TemplateRule rule) {
        expectRule(node, rule);
        if (node instanceof CstNode.NonTerminal nonTerminal) {
            return nonTerminal;
        }
        throw new IllegalStateException("Expected a non-terminal " + rule + " node");
    }

    private static void expectRule(CstNode node, TemplateRule rule) {
        if (node.rule() != rule) {
            throw new IllegalStateException("Expected " + rule + " node, got " + node.rule());
        }
    }
}
