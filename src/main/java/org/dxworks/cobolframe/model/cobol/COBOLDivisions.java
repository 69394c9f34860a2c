package org.dxworks.cobolframe.model.cobol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"identification", "environment", "data", "procedure"})
public class COBOLDivisions {
    public COBOLDivision identification = COBOLDivision.absent();
    public COBOLDivision environment = COBOLDivision.absent();
    public COBOLDivision data = COBOLDivision.absent();
    public COBOLDivision procedure = COBOLDivision.absent();
}
