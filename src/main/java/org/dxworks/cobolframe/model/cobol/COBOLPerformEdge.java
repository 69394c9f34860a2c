package org.dxworks.cobolframe.model.cobol;

public class COBOLPerformEdge {
    public String sourceParagraph;
    public String target;
    public String thruParagraph; // nullable: only PERFORM ... THRU ... carries a range end
}
