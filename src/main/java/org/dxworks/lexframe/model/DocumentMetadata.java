package org.dxworks.lexframe.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DocumentMetadata {
    public String title;
    public int totalUnits;
    public int totalArticles;
    public int totalParagraphs;
    public int totalPoints;
    public int totalDefinitions;
    public boolean hasAnnexes;
    public List<String> amendmentArticles = new ArrayList<>();
}
