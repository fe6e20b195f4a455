package org.dxworks.apislice.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Symbol inventory of a single source file: declarations, call sites and imports.
 * All line numbers are 1-based and inclusive.
 */
public class FileInventory {
    public String filePath;
    public String dialect;
    public List<SymbolSpan> classes = new ArrayList<>();
    public List<SymbolSpan> functions = new ArrayList<>();
    public List<SymbolSpan> variables = new ArrayList<>();
    public List<CallSite> functionCalls = new ArrayList<>();
    public List<ImportInfo> imports = new ArrayList<>();

    public Set<String> functionNames() {
        Set<String> names = new LinkedHashSet<>();
        for (SymbolSpan function : functions) {
            names.add(function.name);
        }
        return names;
    }

    public List<SymbolSpan> functionsNamed(String name) {
        List<SymbolSpan> result = new ArrayList<>();
        for (SymbolSpan function : functions) {
            if (function.name.equals(name)) {
                result.add(function);
            }
        }
        return result;
    }
}
