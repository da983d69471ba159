package turtlefmt.model;

public enum NodeKind {
    DOCUMENT("turtle_doc"),
    COMMENT("comment"),
    BASE("base"),
    PREFIX("prefix"),
    PN_PREFIX("pn_prefix"),
    TRIPLES("triples"),
    PREDICATE_OBJECTS("predicate_objects"),
    IRIREF("iriref"),
    PREFIXED_NAME("prefixed_name"),
    A("a"),
    ANON("anon"),
    BLANK_NODE_LABEL("blank_node_label"),
    BLANK_NODE_PROPERTY_LIST("blank_node_property_list"),
    COLLECTION("collection"),
    LITERAL("literal"),
    STRING("string"),
    LANGTAG("langtag"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    DECIMAL("decimal"),
    DOUBLE("double"),
    ERROR("ERROR"),
    MISSING("MISSING");

    private final String sexpName;

    NodeKind(String sexpName) {
        this.sexpName = sexpName;
    }

    public String sexpName() {
        return sexpName;
    }
}
