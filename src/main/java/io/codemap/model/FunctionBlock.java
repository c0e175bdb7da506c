package io.codemap.model;

import java.util.List;
import java.util.Objects;

/**
 * One function clause and the calls made by its body.
 * <p>
 * Clauses that share a name are separate blocks. Arity information is optional:
 * a clause built by hand may carry neither {@code arity} nor {@code parameters}.
 *
 * @param name          Function name
 * @param kind          Definition macro
 * @param arity         Declared arity including defaulted parameters, or null if unknown
 * @param parameters    Parameter display names, or null if the head carried no list
 * @param defaultCount  Number of trailing parameters declared with a default
 * @param calls         Calls in call-site order
 * @param position      Declaration site, or null
 */
public record FunctionBlock(
    String name,
    FunctionKind kind,
    Integer arity,
    List<String> parameters,
    int defaultCount,
    List<Call> calls,
    Position position
) implements Block {

    public FunctionBlock {
        Objects.requireNonNull(name, "name");
        kind = kind != null ? kind : FunctionKind.DEF;
        parameters = parameters != null ? List.copyOf(parameters) : null;
        calls = List.copyOf(calls);
    }

    /**
     * Clause with no arity information, as produced by older block sources.
     */
    public static FunctionBlock of(String name, List<Call> calls) {
        return new FunctionBlock(name, FunctionKind.DEF, null, null, 0, calls, null);
    }

    /**
     * Clause with an explicit arity.
     */
    public static FunctionBlock of(String name, int arity, List<Call> calls) {
        return new FunctionBlock(name, FunctionKind.DEF, arity, null, 0, calls, null);
    }

    /**
     * Smallest arity this clause accepts, or null if unknown.
     */
    public Integer minArity() {
        return arity == null ? null : arity - defaultCount;
    }

    @Override
    public String displayName() {
        return arity == null ? name : name + "/" + arity;
    }
}
