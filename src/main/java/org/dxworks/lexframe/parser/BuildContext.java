package org.dxworks.lexframe.parser;

import org.dxworks.lexframe.LexframeConfig;
import org.dxworks.lexframe.html.HtmlNode;
import org.dxworks.lexframe.model.Unit;
import org.dxworks.lexframe.model.UnitType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-document builder state handed to every walker: the growing unit list,
 * the ids taken so far and the shared table classifier.
 */
public class BuildContext {

    private final String sourceFile;
    private final LexframeConfig config;
    private final ListTableClassifier listTables;
    private final List<Unit> units = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private final Map<String, Unit> byId = new HashMap<>();
    private final Map<String, Integer> ordinals = new HashMap<>();

    public BuildContext(String sourceFile, LexframeConfig config) {
        this.sourceFile = sourceFile;
        this.config = config;
        this.listTables = new ListTableClassifier(config);
    }

    /**
     * Appends a unit, renaming it when its id is already taken.
     *
     * @return the id the unit was stored under
     */
    public String add(Unit unit) {
        unit.id = UnitIds.uniqueId(ids, unit.id);
        if (unit.id.equals(unit.parentId)) {
            throw new IllegalStateException("Unit " + unit.id + " cannot be its own parent");
        }
        unit.sourceFile = sourceFile;
        ids.add(unit.id);
        byId.put(unit.id, unit);
        units.add(unit);
        return unit.id;
    }

    public Unit find(String id) {
        return id == null ? null : byId.get(id);
    }

    /** Next 1-based counter for generated child ids such as {@code tbl-K} under one parent. */
    public int nextOrdinal(String parentId, String prefix) {
        return ordinals.merge(parentId + "|" + prefix, 1, Integer::sum);
    }

    public static Unit unit(String id, UnitType type, String parentId, String text) {
        Unit unit = new Unit(id, type);
        unit.parentId = parentId;
        unit.text = text == null ? "" : text;
        return unit;
    }

    public boolean isListTable(HtmlNode table) {
        return listTables.isListTable(table);
    }

    public LexframeConfig getConfig() {
        return config;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public List<Unit> getUnits() {
        return Collections.unmodifiableList(units);
    }
}
