package io.codemap.ast;

import io.codemap.model.Attribute;
import io.codemap.model.Call;
import io.codemap.model.FunctionBlock;
import io.codemap.model.FunctionKind;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one module's raw syntax tree into a {@link ModuleBlock}.
 * <p>
 * The conversion runs in three passes over the top-level statements:
 * <ol>
 *   <li>collect aliases into an {@link AliasTable}</li>
 *   <li>turn every {@code def}/{@code defp}/{@code defmacro}/{@code defmacrop} clause into a
 *       {@link FunctionBlock}, reading its body with an {@link ExprReader} and flattening it
 *       with {@link CallExtractor}</li>
 *   <li>collect {@code @attribute value} declarations</li>
 * </ol>
 * Instances hold no state and may be shared between threads.
 */
public class AstNormalizer {

    private static final List<String> BODY_SECTIONS = List.of("do", "rescue", "catch", "else", "after");

    /**
     * Normalize a {@code defmodule} tree.
     *
     * @throws NormalizationException if the tree is not a {@code defmodule Alias do ... end} form
     */
    public ModuleBlock normalize(RawNode tree) throws NormalizationException {
        if (tree == null || !tree.isForm("defmodule")) {
            throw new NormalizationException("Not a module declaration: " + describe(tree));
        }
        RawNode.Form module = (RawNode.Form) tree;
        List<RawNode> args = module.args();
        if (args == null || args.size() != 2) {
            throw new NormalizationException("Unrecognized module declaration: " + describe(tree));
        }

        List<String> nameParts = AliasTable.aliasParts(args.get(0), null);
        if (nameParts.isEmpty()) {
            throw new NormalizationException("Unrecognized module name: " + describe(args.get(0)));
        }
        ModuleIdentifier name = ModuleIdentifier.of(nameParts);
        RawNode body = keyword(args.get(1), "do");
        if (body == null && !ExprReader.isKeywordList(args.get(1))) {
            throw new NormalizationException("Module " + name + " has no do block");
        }

        List<RawNode> statements = statements(body);
        AliasTable aliases = AliasTable.collect(name, statements);
        ExprReader reader = new ExprReader(aliases);

        List<FunctionBlock> functions = new ArrayList<>();
        List<Attribute> attributes = new ArrayList<>();
        for (RawNode statement : statements) {
            FunctionBlock function = toFunctionBlock(statement, reader);
            if (function != null) {
                functions.add(function);
                continue;
            }
            Attribute attribute = toAttribute(statement);
            if (attribute != null) {
                attributes.add(attribute);
            }
        }

        return new ModuleBlock(name, functions, attributes, module.position());
    }

    private static List<RawNode> statements(RawNode body) {
        if (body == null) {
            return List.of();
        }
        if (body.isForm("__block__")) {
            List<RawNode> inner = ((RawNode.Form) body).args();
            return inner != null ? inner : List.of();
        }
        return List.of(body);
    }

    /**
     * Returns a function clause, or null if the statement is not a function definition.
     */
    private FunctionBlock toFunctionBlock(RawNode statement, ExprReader reader) {
        String keyword = statement.formName();
        FunctionKind kind = keyword != null ? FunctionKind.fromKeyword(keyword) : null;
        if (kind == null) {
            return null;
        }
        RawNode.Form definition = (RawNode.Form) statement;
        List<RawNode> args = definition.args();
        if (args == null || args.isEmpty()) {
            return null;
        }

        RawNode head = args.get(0);
        if (head.isForm("when")) {
            List<RawNode> guarded = ((RawNode.Form) head).args();
            head = guarded != null && !guarded.isEmpty() ? guarded.get(0) : head;
        }
        String name = head.formName();
        if (name == null) {
            // def unquote(name)(...) cannot be named statically
            return null;
        }

        List<RawNode> params = ((RawNode.Form) head).args();
        List<String> parameters = new ArrayList<>();
        int defaults = 0;
        if (params != null) {
            for (RawNode param : params) {
                if (param.isForm("\\\\")) {
                    defaults++;
                    List<RawNode> parts = ((RawNode.Form) param).args();
                    parameters.add(parts != null && !parts.isEmpty() ? parts.get(0).describe() : param.describe());
                } else {
                    parameters.add(param.describe());
                }
            }
        }

        List<Call> calls = new ArrayList<>();
        if (args.size() > 1) {
            for (String section : BODY_SECTIONS) {
                RawNode sectionBody = keyword(args.get(1), section);
                if (sectionBody != null) {
                    calls.addAll(CallExtractor.extract(reader.read(sectionBody)));
                }
            }
        }

        return new FunctionBlock(name, kind, parameters.size(), parameters, defaults, calls,
            definition.position());
    }

    /**
     * Returns an attribute for {@code @key value}, or null for anything else.
     */
    private static Attribute toAttribute(RawNode statement) {
        if (!statement.isForm("@")) {
            return null;
        }
        List<RawNode> args = ((RawNode.Form) statement).args();
        if (args == null || args.size() != 1) {
            return null;
        }
        RawNode inner = args.get(0);
        String key = inner.formName();
        List<RawNode> values = inner instanceof RawNode.Form f ? f.args() : null;
        if (key == null || values == null || values.size() != 1) {
            return null;
        }
        return new Attribute(key, values.get(0).describe());
    }

    /**
     * Value for a key in a keyword list, or null if absent.
     */
    private static RawNode keyword(RawNode node, String key) {
        if (node instanceof RawNode.ListNode list) {
            for (RawNode element : list.elements()) {
                if (element instanceof RawNode.Pair p && p.left().isAtom(key)) {
                    return p.right();
                }
            }
        }
        return null;
    }

    private static String describe(RawNode node) {
        if (node == null) {
            return "null";
        }
        String text = node.describe();
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }
}
