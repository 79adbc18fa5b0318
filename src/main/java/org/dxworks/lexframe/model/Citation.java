package org.dxworks.lexframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.dxworks.lexframe.Numbers;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Citation {

    /** How the reference was phrased; drives context resolution and is not serialized. */
    public enum Form {
        EXPLICIT,
        POINT_LIST,
        THIS_ARTICLE,
        THIS_PARAGRAPH,
        THIS_SUBPARAGRAPH,
        THIS_ANNEX,
        THIS_ACT,
        THAT_ACT,
        ARTICLE_OF_THAT_ACT,
        THEREOF
    }

    public String rawText;
    public int spanStart;
    public int spanEnd;
    public CitationType citationType = CitationType.INTERNAL;

    public Integer article;
    public String articleLabel;
    public Integer paragraph;
    public String point;
    public int[] articleRange;
    public int[] paragraphRange;
    public String[] pointRange;
    public String subparagraphOrdinal;
    public Integer subparagraphIndex;
    public String chapter;
    public String section;
    public String titleRef;
    public String annex;
    public String annexPart;
    public TreatyCode treatyCode;

    public ActType actType;
    public String actNumber;
    public Integer actYear;
    public String celex;
    public String connectivePhrase;

    public String targetNodeId;

    @JsonIgnore
    public Form form = Form.EXPLICIT;

    /** Act kind named by "this/that Regulation" style references. */
    @JsonIgnore
    public ActType referencedActType;

    public Citation() {
    }

    public Citation(int spanStart, int spanEnd, CitationType citationType) {
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.citationType = citationType;
    }

    @JsonIgnore
    public boolean isInternal() {
        return citationType == CitationType.INTERNAL;
    }

    /** Sets both the raw article label and its leading integer. */
    public void setArticleLabel(String label) {
        this.articleLabel = label;
        this.article = Numbers.leading(label);
    }

    public void copyActFrom(Citation other) {
        this.actType = other.actType;
        this.actNumber = other.actNumber;
        this.actYear = other.actYear;
        this.celex = other.celex;
    }
}
