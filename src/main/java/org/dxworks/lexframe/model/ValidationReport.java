package org.dxworks.lexframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ValidationReport {
    public String sourceFile;
    public Map<String, Integer> countsExpected = new LinkedHashMap<>();
    public Map<String, Integer> countsParsed = new LinkedHashMap<>();
    public List<SequenceGap> sequenceGaps = new ArrayList<>();
    public List<Orphan> orphans = new ArrayList<>();
    public List<UnparsedNode> unparsedNodes = new ArrayList<>();
    public List<Issue> mismatchedLabels = new ArrayList<>();
    public List<Issue> hierarchyIssues = new ArrayList<>();
    public List<Issue> orderingIssues = new ArrayList<>();

    public ValidationReport() {
    }

    public ValidationReport(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    @JsonIgnore
    public boolean isValid() {
        return orphans.isEmpty()
                && sequenceGaps.isEmpty()
                && unparsedNodes.isEmpty()
                && mismatchedLabels.isEmpty()
                && hierarchyIssues.isEmpty()
                && orderingIssues.isEmpty();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Orphan {
        public String id;
        public String parentId;

        public Orphan() {
        }

        public Orphan(String id, String parentId) {
            this.id = id;
            this.parentId = parentId;
        }
    }

    /** A recital, article or annex container of the markup that yielded no unit. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class UnparsedNode {
        public String sourceId;
        public String tag;
        public String reason;

        public UnparsedNode() {
        }

        public UnparsedNode(String sourceId, String tag, String reason) {
            this.sourceId = sourceId;
            this.tag = tag;
            this.reason = reason;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SequenceGap {
        public String type;
        public List<Integer> missing = new ArrayList<>();

        public SequenceGap() {
        }

        public SequenceGap(String type, List<Integer> missing) {
            this.type = type;
            this.missing = missing;
        }
    }

    /** A single structural finding: {@code type} is "wrong_parent_type", "id_mismatch" or "interleaved_points". */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Issue {
        public String type;
        public String id;
        public String message;

        public Issue() {
        }

        public Issue(String type, String id, String message) {
            this.type = type;
            this.id = id;
            this.message = message;
        }
    }
}
