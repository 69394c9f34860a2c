package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"name", "performs", "calls", "io_ops"})
public class COBOLParagraph {
    public String name;
    public List<String> performs = new ArrayList<>();
    public List<COBOLCallReference> calls = new ArrayList<>();

    @JsonProperty("io_ops")
    public List<COBOLIoOperation> ioOperations = new ArrayList<>();

    @JsonIgnore
    public List<COBOLPerformEdge> performEdges = new ArrayList<>();

    /**
     * Records the edge and lists its target, then its THRU end when there is one.
     */
    public void addPerform(COBOLPerformEdge edge) {
        performEdges.add(edge);
        performs.add(edge.target);
        if (edge.thruParagraph != null) {
            performs.add(edge.thruParagraph);
        }
    }
}
