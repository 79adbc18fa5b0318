package org.dxworks.lexframe.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.dxworks.lexframe.DocumentFormat;

import java.util.ArrayList;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ParseResult {
    public String sourceFile;
    public DocumentFormat format;
    public DocumentMetadata documentMetadata;
    public List<Unit> units = new ArrayList<>();
    public ValidationReport validation;
}
