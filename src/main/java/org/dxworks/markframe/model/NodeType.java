package org.dxworks.markframe.model;

public enum NodeType {
    DOC("doc", Kind.CONTAINER),
    PARAGRAPH("paragraph", Kind.TEXTBLOCK),
    HEADING("heading", Kind.TEXTBLOCK),
    CODE_BLOCK("code_block", Kind.TEXTBLOCK),
    BLOCKQUOTE("blockquote", Kind.CONTAINER),
    BULLET_LIST("bullet_list", Kind.CONTAINER),
    ORDERED_LIST("ordered_list", Kind.CONTAINER),
    LIST_ITEM("list_item", Kind.CONTAINER),
    TASK_LIST("task_list", Kind.CONTAINER),
    TASK_ITEM("task_item", Kind.CONTAINER),
    TABLE("table", Kind.CONTAINER),
    TABLE_ROW("table_row", Kind.CONTAINER),
    TABLE_HEADER("table_header", Kind.TEXTBLOCK),
    TABLE_CELL("table_cell", Kind.TEXTBLOCK),
    IMAGE("image", Kind.LEAF),
    HORIZONTAL_RULE("horizontal_rule", Kind.LEAF),
    HTML_BLOCK("html_block", Kind.TEXTBLOCK),
    MATH_BLOCK("math_block", Kind.TEXTBLOCK),
    CONTAINER("container", Kind.CONTAINER),
    TEXT("text", Kind.INLINE);

    private enum Kind { CONTAINER, TEXTBLOCK, LEAF, INLINE }

    private final String name;
    private final Kind kind;

    NodeType(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    /** Blocks whose content is a sequence of text runs. */
    public boolean isTextblock() {
        return kind == Kind.TEXTBLOCK;
    }

    /** Blocks without content; they occupy a single position. */
    public boolean isLeaf() {
        return kind == Kind.LEAF;
    }

    public boolean isText() {
        return kind == Kind.INLINE;
    }

    /**
     * Block kinds that source view presents as raw paragraphs.
     */
    public boolean isSourceViewStructured() {
        return switch (this) {
            case CODE_BLOCK, IMAGE, HORIZONTAL_RULE, TABLE, HTML_BLOCK, MATH_BLOCK -> true;
            default -> false;
        };
    }
}
