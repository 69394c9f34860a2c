package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"op", "dataset_ref", "fields"})
public class COBOLIoOperation {
    @JsonIgnore
    public String sourceParagraph;
    public String op; // OPEN, READ, WRITE, REWRITE, CLOSE

    @JsonProperty("dataset_ref")
    public String datasetRef;

    // Field-level detail is not extracted; always empty
    public List<String> fields = new ArrayList<>();
}
