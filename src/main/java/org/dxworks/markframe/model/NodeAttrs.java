package org.dxworks.markframe.model;

/**
 * Attribute keys used on document nodes.
 */
public final class NodeAttrs {

    private NodeAttrs() {
        // constants
    }

    public static final String LEVEL = "level";
    public static final String LANGUAGE = "language";
    public static final String START = "start";
    public static final String CHECKED = "checked";
    public static final String ALIGN = "align";

    public static final String SRC = "src";
    public static final String ALT = "alt";
    public static final String TITLE = "title";

    public static final String CONTAINER_TYPE = "type";
    public static final String CONTAINER_TITLE = "title";

    // block-group attributes, present only while a structured block is flattened
    public static final String CODE_BLOCK_ID = "codeBlockId";
    public static final String TABLE_ID = "tableId";
    public static final String HTML_BLOCK_ID = "htmlBlockId";
    public static final String MATH_BLOCK_ID = "mathBlockId";
    public static final String LINE_INDEX = "lineIndex";
    public static final String TOTAL_LINES = "totalLines";
    public static final String IMAGE_ATTRS = "imageAttrs";
    public static final String HR_SOURCE = "hrSource";
}
