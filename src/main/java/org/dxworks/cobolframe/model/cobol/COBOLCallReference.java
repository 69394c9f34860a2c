package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"target", "dynamic"})
public class COBOLCallReference {
    @JsonIgnore
    public String sourceParagraph;
    public String target;
    public boolean dynamic; // true when the target is a data name resolved at run time
}
