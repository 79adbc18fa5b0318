package org.dxworks.lexframe.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Unit {
    public String id;
    public UnitType type;
    public String ref;
    public String text = "";
    public String parentId;
    public String sourceId;
    public String sourceFile;

    // hierarchy addressing
    public String articleNumber;
    public String paragraphNumber;
    public Integer paragraphIndex;
    public String pointLabel;
    public String subpointLabel;
    public String subsubpointLabel;
    public List<String> extraLabels;
    public String annexNumber;
    public String annexPart;
    public String recitalNumber;
    public Integer subparagraphIndex;
    public String heading;

    public boolean isAmendmentText;

    // filled by the enrichment pass
    public Integer childrenCount;
    public Boolean isLeaf;
    public Boolean isStem;
    public String articleHeading;
    public String targetPath;
    public Integer wordCount;
    public Integer charCount;
    public List<Citation> citations = new ArrayList<>();

    public Unit() {
    }

    public Unit(String id, UnitType type) {
        this.id = id;
        this.type = type;
    }
}
