package com.board.core.service.graph;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Allow-list of node labels this service writes.
 *
 * Labels are interpolated into Cypher text, so only these literal names
 * ever reach a statement. Item types outside the list map to {@link #UNKNOWN}.
 */
public enum NodeLabel {

    BOARD("Board"),

    // Eventstorming
    COMMAND("Command"),
    EVENT("Event"),
    AGGREGATE("Aggregate"),
    POLICY("Policy"),
    READ_MODEL("ReadModel"),
    ACTOR("Actor"),
    EXTERNAL_SYSTEM("ExternalSystem"),
    BOUNDED_CONTEXT("BoundedContext"),

    // UML
    UML_BOARD("UmlBoard"),
    CLASS("Class"),
    INTERFACE("Interface"),
    ENUM("Enum"),
    PACKAGE("Package"),

    UNKNOWN("Unknown");

    private static final Map<String, NodeLabel> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(NodeLabel::labelName, Function.identity()));

    private static final Set<NodeLabel> NAME_INDEXED =
            EnumSet.of(COMMAND, EVENT, AGGREGATE, BOUNDED_CONTEXT);

    private final String labelName;

    NodeLabel(String labelName) {
        this.labelName = labelName;
    }

    public String labelName() {
        return labelName;
    }

    /**
     * Whether nodes under this label are board items (everything but Board).
     */
    public boolean isItemLabel() {
        return this != BOARD;
    }

    /**
     * Whether the schema declares a lookup index on {@code name} for this label.
     */
    public boolean isNameIndexed() {
        return NAME_INDEXED.contains(this);
    }

    /**
     * Resolves the label for an item type. Null, blank, unknown or
     * {@code Board} types resolve to {@link #UNKNOWN}.
     */
    public static NodeLabel forItemType(Object type) {
        if (!(type instanceof String name) || name.isBlank()) {
            return UNKNOWN;
        }
        return fromLabelName(name)
                .filter(NodeLabel::isItemLabel)
                .orElse(UNKNOWN);
    }

    public static Optional<NodeLabel> fromLabelName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static Set<NodeLabel> itemLabels() {
        return EnumSet.complementOf(EnumSet.of(BOARD));
    }
}
