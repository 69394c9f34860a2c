package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.cobolframe.model.Analysis;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"status", "engine", "programId", "sourceFormat", "file", "divisions",
        "paragraphs", "copybooks_used", "notes"})
public class COBOLProgramAnalysis implements Analysis {
    public String status = STATUS_OK;
    public String engine;
    public String programId = "";
    public String sourceFormat;
    public String file;
    public COBOLDivisions divisions = new COBOLDivisions();
    public List<COBOLParagraph> paragraphs = new ArrayList<>();

    @JsonProperty("copybooks_used")
    public List<String> copybooksUsed = new ArrayList<>();

    public List<String> notes = new ArrayList<>();

    @Override
    public String getStatus() {
        return status;
    }
}
