package io.codemap.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized module: its function clauses in declaration order plus its attributes.
 *
 * @param name       Module identifier
 * @param children   Function clauses in declaration order
 * @param attributes Module attributes in declaration order
 * @param position   Declaration site, or null
 */
public record ModuleBlock(
    ModuleIdentifier name,
    List<FunctionBlock> children,
    List<Attribute> attributes,
    Position position
) implements Block {

    public ModuleBlock {
        Objects.requireNonNull(name, "name");
        children = List.copyOf(children);
        attributes = List.copyOf(attributes);
    }

    public static ModuleBlock of(ModuleIdentifier name, List<FunctionBlock> children) {
        return new ModuleBlock(name, children, List.of(), null);
    }

    /**
     * All clauses with the given name, in declaration order.
     */
    public List<FunctionBlock> clauses(String functionName) {
        return children.stream()
            .filter(f -> f.name().equals(functionName))
            .toList();
    }

    /**
     * First attribute with the given key.
     */
    public Optional<Attribute> attribute(String key) {
        return attributes.stream()
            .filter(a -> a.key().equals(key))
            .findFirst();
    }

    @Override
    public String displayName() {
        return name.toString();
    }
}
